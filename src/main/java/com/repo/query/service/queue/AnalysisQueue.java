package com.repo.query.service.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * external task queue the analysis runs are handed to when it is reachable
 */
public interface AnalysisQueue {

    /**
     * checks that the queue answers within the given time. Never throws.
     *
     * @param timeout
     * @return
     */
    boolean ping(Duration timeout);

    /**
     * @param payload
     * @return task id under which the payload was queued
     */
    String enqueue(AnalysisTaskPayload payload);

    Optional<AnalysisTaskPayload> poll();
}
