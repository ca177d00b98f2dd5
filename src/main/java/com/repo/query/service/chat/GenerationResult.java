package com.repo.query.service.chat;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * outcome of a generation call. An unavailable backend is a value, not an exception:
 * UNREACHABLE when the backend could not be reached in time, FAILED for any other backend error.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class GenerationResult {
    public enum Status {
        GENERATED,
        UNREACHABLE,
        FAILED
    }

    private final Status status;
    private final String text;
    private final String reason;

    public static GenerationResult generated(String text) {
        return new GenerationResult(Status.GENERATED, text, null);
    }

    public static GenerationResult unreachable(String reason) {
        return new GenerationResult(Status.UNREACHABLE, null, reason);
    }

    public static GenerationResult failed(String reason) {
        return new GenerationResult(Status.FAILED, null, reason);
    }

    public boolean isAvailable() {
        return status == Status.GENERATED;
    }
}
