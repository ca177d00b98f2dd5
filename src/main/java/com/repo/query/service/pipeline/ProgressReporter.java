package com.repo.query.service.pipeline;

public interface ProgressReporter {
    //  records the checkpoint in the run state and persists it before returning
    void report(PipelineStage stage);
}
