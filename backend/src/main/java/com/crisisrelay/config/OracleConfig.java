package com.crisisrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.crisisrelay.oracle.CallbackVerifier;
import com.crisisrelay.oracle.HttpOracleClient;
import com.crisisrelay.oracle.OracleClient;

@Configuration
public class OracleConfig {

    @Bean
    public WebClient oracleWebClient(WebClient.Builder builder, RelayProperties properties) {
        return builder
                .baseUrl(properties.oracle().baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public OracleClient oracleClient(WebClient oracleWebClient, RelayProperties properties) {
        return new HttpOracleClient(oracleWebClient, properties.oracle().callbackBaseUrl(), properties.oracle().timeout());
    }

    /** Fails startup when the verifying key is missing or not a raw Ed25519 public key. */
    @Bean
    public CallbackVerifier callbackVerifier(RelayProperties properties) {
        return CallbackVerifier.fromBase64(properties.oracle().verifyingKey());
    }
}
