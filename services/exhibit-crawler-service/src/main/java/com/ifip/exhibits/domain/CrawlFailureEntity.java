package com.ifip.exhibits.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "crawl_failures")
public class CrawlFailureEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "index_html_url", length = 1024)
    private String indexHtmlUrl;

    @Column(name = "failure_code", nullable = false)
    private String failureCode;

    @Column(name = "failure_reason", nullable = false, length = 512)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static CrawlFailureEntity of(UUID runId, String indexHtmlUrl, String code, String reason) {
        CrawlFailureEntity entity = new CrawlFailureEntity();
        entity.id = UUID.randomUUID();
        entity.runId = runId;
        entity.indexHtmlUrl = indexHtmlUrl;
        entity.failureCode = code;
        entity.failureReason = reason;
        entity.createdAt = Instant.now();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getIndexHtmlUrl() {
        return indexHtmlUrl;
    }

    public String getFailureCode() {
        return failureCode;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
