package com.ifip.exhibits.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "crawl_runs")
public class CrawlRunEntity {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunStatus status;

    @Column(name = "start_year", nullable = false)
    private int startYear;

    @Column(name = "end_year", nullable = false)
    private int endYear;

    @Column(name = "indices_acquired", nullable = false)
    private int indicesAcquired;

    @Column(name = "filings_matched", nullable = false)
    private int filingsMatched;

    @Column(name = "pages_processed", nullable = false)
    private int pagesProcessed;

    @Column(name = "pages_skipped", nullable = false)
    private int pagesSkipped;

    @Column(name = "exhibits_found", nullable = false)
    private int exhibitsFound;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "error_summary", length = 512)
    private String errorSummary;

    public static CrawlRunEntity startNew(int startYear, int endYear) {
        CrawlRunEntity run = new CrawlRunEntity();
        run.runId = UUID.randomUUID();
        run.startedAt = Instant.now();
        run.status = RunStatus.QUEUED;
        run.startYear = startYear;
        run.endYear = endYear;
        return run;
    }

    public void markRunning() {
        this.status = RunStatus.RUNNING;
    }

    public void recordIndices(int indicesAcquired, int filingsMatched) {
        this.indicesAcquired = indicesAcquired;
        this.filingsMatched = filingsMatched;
    }

    public void recordPage(int exhibitsRetrieved) {
        this.pagesProcessed++;
        this.exhibitsFound += exhibitsRetrieved;
    }

    public void incrementSkipped() {
        this.pagesSkipped++;
    }

    public void incrementFailed() {
        this.failedCount++;
    }

    public void complete() {
        this.completedAt = Instant.now();
        this.status = this.failedCount > 0 ? RunStatus.PARTIAL_SUCCESS : RunStatus.SUCCEEDED;
    }

    public void stall(String errorSummary) {
        this.completedAt = Instant.now();
        this.status = RunStatus.STALLED;
        this.errorSummary = errorSummary;
    }

    public void fail(String errorSummary) {
        this.completedAt = Instant.now();
        this.status = RunStatus.FAILED;
        this.errorSummary = errorSummary;
    }

    public boolean isActive() {
        return status == RunStatus.QUEUED || status == RunStatus.RUNNING;
    }

    public UUID getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getStartYear() {
        return startYear;
    }

    public int getEndYear() {
        return endYear;
    }

    public int getIndicesAcquired() {
        return indicesAcquired;
    }

    public int getFilingsMatched() {
        return filingsMatched;
    }

    public int getPagesProcessed() {
        return pagesProcessed;
    }

    public int getPagesSkipped() {
        return pagesSkipped;
    }

    public int getExhibitsFound() {
        return exhibitsFound;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public String getErrorSummary() {
        return errorSummary;
    }
}
