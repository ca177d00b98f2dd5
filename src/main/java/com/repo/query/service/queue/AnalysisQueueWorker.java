package com.repo.query.service.queue;

import com.repo.query.service.pipeline.AnalysisPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * consumes queued analysis tasks one at a time
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "query.worker.enabled", havingValue = "true", matchIfMissing = true)
public class AnalysisQueueWorker {
    private final AnalysisQueue analysisQueue;
    private final AnalysisPipelineService pipelineService;

    @Scheduled(fixedDelayString = "${query.worker.poll-delay-ms:2000}")
    public void drain() {
        while (true) {
            Optional<AnalysisTaskPayload> next;
            try {
                next = analysisQueue.poll();
            } catch (RuntimeException err) {
                log.debug("Task queue poll failed: {}", err.getMessage());
                return;
            }
            if (next.isEmpty()) return;

            process(next.get());
        }
    }

    void process(AnalysisTaskPayload payload) {
        log.info("Picked up analysis task {} for repository {}", payload.getTaskId(), payload.getRepositoryId());
        try {
            pipelineService.run(payload.getRepositoryId(), payload.getJobId(), payload.getTaskId());
        } catch (RuntimeException err) {
            log.error("Analysis task {} failed: {}", payload.getTaskId(), err.getMessage());
        }
    }
}
