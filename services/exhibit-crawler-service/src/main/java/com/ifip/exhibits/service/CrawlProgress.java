package com.ifip.exhibits.service;

import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class CrawlProgress {

    private volatile Snapshot current = Snapshot.idle();

    public void start(UUID runId) {
        current = new Snapshot(runId, "STARTING", 0, 0, Instant.now());
    }

    public void enterStage(String stage) {
        current = new Snapshot(current.runId(), stage, 0, 0, Instant.now());
    }

    public void recordRetryPass(String stage, int pass, int pending) {
        current = new Snapshot(current.runId(), stage, pass, pending, Instant.now());
    }

    public void reset() {
        current = Snapshot.idle();
    }

    public Snapshot snapshot() {
        return current;
    }

    // runId is null while no crawl is executing
    public record Snapshot(UUID runId, String stage, int retryPass, int pendingRetries, Instant updatedAt) {

        static Snapshot idle() {
            return new Snapshot(null, "IDLE", 0, 0, Instant.now());
        }

        public boolean isRetrying() {
            return retryPass > 0;
        }

        public boolean isFor(UUID otherRunId) {
            return runId != null && runId.equals(otherRunId);
        }
    }
}
