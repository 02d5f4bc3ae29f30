package com.ifip.exhibits.domain;

public enum RunStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    STALLED,
    FAILED
}
