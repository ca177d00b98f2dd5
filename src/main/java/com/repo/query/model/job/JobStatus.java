package com.repo.query.model.job;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static JobStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
