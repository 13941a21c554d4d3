package com.crisisrelay.record;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RecordRepository extends ReactiveCassandraRepository<RecordEntity, Long> {
    // Inherits: findById(id), insert(entity), findAll(), etc.
    // Conditional state changes go through CQL lightweight transactions in CassandraRecordStore.
}
