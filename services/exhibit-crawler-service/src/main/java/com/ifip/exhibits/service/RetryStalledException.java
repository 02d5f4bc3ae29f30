package com.ifip.exhibits.service;

public class RetryStalledException extends RuntimeException {

    private final String stage;
    private final int passes;
    private final int pendingCount;

    public RetryStalledException(String stage, int passes, int pendingCount) {
        super(stage + " still has " + pendingCount + " unresolved item(s) after " + passes + " retry pass(es)");
        this.stage = stage;
        this.passes = passes;
        this.pendingCount = pendingCount;
    }

    public String getStage() {
        return stage;
    }

    public int getPasses() {
        return passes;
    }

    public int getPendingCount() {
        return pendingCount;
    }
}
