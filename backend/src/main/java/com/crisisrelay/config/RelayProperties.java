package com.crisisrelay.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Relay settings, bound from the {@code relay.*} block of application.yml.
 *
 * @param counselor identity of the single privileged party, as sent in {@code X-Actor-Id}
 * @param storage   where records and the request ledger live
 * @param oracle    oracle gateway endpoints and the key its callbacks are signed with
 */
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
        String counselor,
        @DefaultValue("cassandra") Storage storage,
        Oracle oracle
) {

    public enum Storage {
        /** Process-local maps. State is lost on restart; meant for development and tests. */
        MEMORY,
        CASSANDRA
    }

    /**
     * @param baseUrl         oracle gateway, e.g. {@code http://oracle-gateway:8090}
     * @param callbackBaseUrl public URL of this relay's callback endpoints, sent along with every request
     * @param verifyingKey    base64 of the oracle's raw 32-byte Ed25519 public key
     * @param timeout         applied to request issuance and health checks
     */
    public record Oracle(
            String baseUrl,
            String callbackBaseUrl,
            String verifyingKey,
            @DefaultValue("5s") Duration timeout
    ) {}
}
