package com.repo.query.model.repo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChunkType {
    FUNCTION,
    CLASS,
    BLOCK;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static ChunkType fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
