package com.ifip.exhibits.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "fetch_cache")
public class FetchCacheEntryEntity {

    @Id
    @Column(name = "fingerprint", nullable = false, updatable = false, length = 32)
    private String fingerprint;

    @Column(name = "operation", nullable = false)
    private String operation;

    @Lob
    @Column(name = "payload", nullable = false)
    private byte[] payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static FetchCacheEntryEntity of(String fingerprint, String operation, byte[] payload) {
        FetchCacheEntryEntity entity = new FetchCacheEntryEntity();
        entity.fingerprint = fingerprint;
        entity.operation = operation;
        entity.payload = payload;
        return entity;
    }

    public void overwrite(String operation, byte[] payload) {
        this.operation = operation;
        this.payload = payload;
    }

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.createdAt = Instant.now();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getOperation() {
        return operation;
    }

    public byte[] getPayload() {
        return payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
