package com.repo.query.model.repo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RepoStatus {
    PENDING,
    ANALYZING,
    READY,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static RepoStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
