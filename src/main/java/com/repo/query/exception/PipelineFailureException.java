package com.repo.query.exception;

/**
 * fatal to a single analysis run; the repository and its job are marked failed before this propagates
 */
public class PipelineFailureException extends RuntimeException {
    public PipelineFailureException(String message) {
        super(message);
    }

    public PipelineFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
