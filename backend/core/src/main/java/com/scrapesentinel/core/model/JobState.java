package com.scrapesentinel.core.model;

public enum JobState {
    IDLE,
    RUNNING,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == FAILED || this == CANCELLED;
    }
}
