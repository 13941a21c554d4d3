package com.crisisrelay.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.crisisrelay.protocol.Actor;
import com.crisisrelay.protocol.ProtocolSettings;

@Configuration
public class ProtocolConfig {

    @Bean
    public ProtocolSettings protocolSettings(RelayProperties properties) {
        return new ProtocolSettings(new Actor(properties.counselor()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
