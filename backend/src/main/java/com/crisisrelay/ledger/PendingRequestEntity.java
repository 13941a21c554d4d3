package com.crisisrelay.ledger;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("pending_requests")
public class PendingRequestEntity {

    @PrimaryKey("request_id")
    private String requestId;

    @Column("record_id")
    private long recordId;

    @Column("kind")
    private String kind;

    /** Tombstone flag. Resolved rows stay so the id can never be registered or resolved again. */
    @Column("resolved")
    private boolean resolved;

    public PendingRequestEntity() {}

    static PendingRequestEntity pending(RequestId requestId, long recordId, RequestKind kind) {
        PendingRequestEntity entity = new PendingRequestEntity();
        entity.setRequestId(requestId.value());
        entity.setRecordId(recordId);
        entity.setKind(kind.name());
        entity.setResolved(false);
        return entity;
    }

    PendingRequest toPendingRequest() {
        return new PendingRequest(new RequestId(requestId), recordId, RequestKind.valueOf(kind));
    }

    // Getters & Setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }
    public long getRecordId() { return recordId; }
    public void setRecordId(long recordId) { this.recordId = recordId; }
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public boolean isResolved() { return resolved; }
    public void setResolved(boolean resolved) { this.resolved = resolved; }
}
