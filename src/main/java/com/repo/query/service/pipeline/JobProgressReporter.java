package com.repo.query.service.pipeline;

import com.repo.query.model.job.AnalysisJob;
import com.repo.query.model.job.AnalysisJobRepository;
import lombok.extern.slf4j.Slf4j;

/**
 * progress reporter backed by the job row, so what the run loop sees and what status queries see is one record
 */
@Slf4j
public class JobProgressReporter implements ProgressReporter {
    private final AnalysisJobRepository jobRepository;
    private AnalysisJob job;

    public JobProgressReporter(AnalysisJob job, AnalysisJobRepository jobRepository) {
        this.job = job;
        this.jobRepository = jobRepository;
    }

    @Override
    public void report(PipelineStage stage) {
        if (stage == PipelineStage.DONE) job.complete();
        else job.advanceTo(stage.getProgress());

        job = jobRepository.save(job);
        log.info("Job {} for repository {}: {} ({}%)",
                job.getId(), job.getRepositoryId(), stage.getLabel(), job.getProgressPercentage());
    }
}
