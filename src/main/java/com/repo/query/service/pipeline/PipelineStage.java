package com.repo.query.service.pipeline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * checkpoints of an analysis run and the job progress recorded when each one is reached
 */
@Getter
@RequiredArgsConstructor
public enum PipelineStage {
    CLONING("cloning", 10),
    DISCOVERING("discovering", 20),
    CHUNKING("chunking", 40),
    EMBEDDING("embedding", 60),
    STORING("storing", 85),
    DONE("done", 100);

    private final String label;
    private final int progress;
}
