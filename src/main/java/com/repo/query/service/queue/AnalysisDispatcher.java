package com.repo.query.service.queue;

import com.repo.query.service.pipeline.AnalysisPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

/**
 * decides where an analysis run executes. Exactly one of three paths is taken per request:
 * <ol>
 *     <li>the external queue, when it answers a ping in time</li>
 *     <li>the in-process analysis executor, after the request returns</li>
 *     <li>the caller's thread, when the executor refuses the task</li>
 * </ol>
 */
@Slf4j
@Service
public class AnalysisDispatcher {
    public static final String LOCAL_TASK_ID = "local-task";

    private final AnalysisQueue analysisQueue;
    private final TaskExecutor analysisTaskExecutor;
    private final AnalysisPipelineService pipelineService;
    private final Duration pingTimeout;

    public AnalysisDispatcher(
            AnalysisQueue analysisQueue,
            @Qualifier("analysisTaskExecutor") TaskExecutor analysisTaskExecutor,
            AnalysisPipelineService pipelineService,
            @Value("${query.queue.ping-timeout:500ms}") Duration pingTimeout
    ) {
        this.analysisQueue = analysisQueue;
        this.analysisTaskExecutor = analysisTaskExecutor;
        this.pipelineService = pipelineService;
        this.pingTimeout = pingTimeout;
    }

    /**
     * hands the analysis of a repository to the queue or runs it locally
     *
     * @param repositoryId
     * @param jobId job created for this request
     * @return queue task id, or {@link #LOCAL_TASK_ID} when the run stays in-process
     */
    public String dispatch(Long repositoryId, Long jobId) {
        AnalysisTaskPayload payload = AnalysisTaskPayload.builder()
                .taskId(UUID.randomUUID().toString())
                .repositoryId(repositoryId)
                .jobId(jobId)
                .build();

        if (analysisQueue.ping(pingTimeout)) {
            try {
                return analysisQueue.enqueue(payload);
            } catch (RuntimeException err) {
                log.warn("Enqueue failed for repository {}, running locally: {}", repositoryId, err.getMessage());
            }
        } else {
            log.info("Task queue unavailable, running analysis of repository {} in-process", repositoryId);
        }

        runLocally(payload.toBuilder().taskId(LOCAL_TASK_ID).build());
        return LOCAL_TASK_ID;
    }

    private void runLocally(AnalysisTaskPayload payload) {
        Runnable task = () -> runPipeline(payload);
        try {
            analysisTaskExecutor.execute(task);
        } catch (TaskRejectedException err) {
            log.warn("Analysis executor rejected repository {}, running synchronously", payload.getRepositoryId());
            task.run();
        }
    }

    /**
     * the pipeline records its own failure on the repository and job; here it is only observed
     *
     * @param payload
     */
    private void runPipeline(AnalysisTaskPayload payload) {
        try {
            pipelineService.run(payload.getRepositoryId(), payload.getJobId(), payload.getTaskId());
        } catch (RuntimeException err) {
            log.error("Local analysis of repository {} failed: {}", payload.getRepositoryId(), err.getMessage());
        }
    }
}
