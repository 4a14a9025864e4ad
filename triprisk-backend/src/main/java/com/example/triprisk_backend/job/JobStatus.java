package com.example.triprisk_backend.job;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    boolean canMoveTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
