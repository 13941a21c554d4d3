package com.crisisrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;

import com.crisisrelay.ledger.CassandraRequestLedger;
import com.crisisrelay.ledger.InMemoryRequestLedger;
import com.crisisrelay.ledger.RequestLedger;
import com.crisisrelay.record.CassandraRecordStore;
import com.crisisrelay.record.InMemoryRecordStore;
import com.crisisrelay.record.RecordRepository;
import com.crisisrelay.record.RecordStore;

/**
 * Chooses the record store and request ledger from {@code relay.storage}.
 * Memory mode must run with the Cassandra auto-configuration excluded (see application-memory.yml).
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Configuration
    @ConditionalOnProperty(prefix = "relay", name = "storage", havingValue = "cassandra", matchIfMissing = true)
    static class CassandraStorage {

        @Bean
        public RecordStore recordStore(RecordRepository recordRepository, ReactiveCassandraOperations operations) {
            log.info("Records and request ledger persisted in Cassandra");
            return new CassandraRecordStore(recordRepository, operations.getReactiveCqlOperations());
        }

        @Bean
        public RequestLedger requestLedger(ReactiveCassandraOperations operations) {
            return new CassandraRequestLedger(operations);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "relay", name = "storage", havingValue = "memory")
    static class InMemoryStorage {

        @Bean
        public RecordStore recordStore() {
            log.warn("Records and request ledger held in memory; all state is lost on restart");
            return new InMemoryRecordStore();
        }

        @Bean
        public RequestLedger requestLedger() {
            return new InMemoryRequestLedger();
        }
    }
}
