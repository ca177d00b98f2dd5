package com.repo.query.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * task queue on a redis list: producers RPUSH json payloads, the worker LPOPs them in order
 */
@Slf4j
@Component
public class RedisAnalysisQueue implements AnalysisQueue {
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String queueKey;

    //  the ping runs off the caller's thread so a hung connection cannot hold the request past the timeout
    private final ExecutorService pingExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "queue-ping");
        thread.setDaemon(true);
        return thread;
    });

    public RedisAnalysisQueue(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${query.queue.key:query:analysis:tasks}") String queueKey
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.queueKey = queueKey;
    }

    @Override
    public boolean ping(Duration timeout) {
        Future<String> ping;
        //  PING on the daemon executor, the caller only waits for the future
        try {
            ping = pingExecutor.submit(() -> redisTemplate.execute((RedisCallback<String>) connection -> connection.ping()));
        } catch (RuntimeException err) {
            log.warn("Could not start queue ping: {}", err.getMessage());
            return false;
        }

        try {
            //  anything but PONG counts as unreachable
            return "PONG".equalsIgnoreCase(ping.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException err) {
            //  stop waiting on the hung connection
            ping.cancel(true);
            log.info("Queue did not answer within {}ms", timeout.toMillis());
            return false;
        } catch (ExecutionException err) {
            //  connection refused, auth errors and the like
            log.info("Queue unreachable: {}", err.getCause() == null ? err.getMessage() : err.getCause().getMessage());
            return false;
        } catch (InterruptedException err) {
            //  restore the flag for the caller
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String enqueue(AnalysisTaskPayload payload) {
        String json;
        //  payloads travel as json strings
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException err) {
            throw new IllegalStateException("Cannot serialize analysis task " + payload.getTaskId(), err);
        }

        //  RPUSH on the tail, the worker pops from the head so tasks run in arrival order
        Long size = redisTemplate.opsForList().rightPush(queueKey, json);
        log.info("Queued analysis task {} for repository {} ({} waiting)", payload.getTaskId(), payload.getRepositoryId(), size);
        return payload.getTaskId();
    }

    @Override
    public Optional<AnalysisTaskPayload> poll() {
        //  non-blocking LPOP, an empty queue answers null
        String json = redisTemplate.opsForList().leftPop(queueKey);
        if (json == null) return Optional.empty();

        try {
            return Optional.of(objectMapper.readValue(json, AnalysisTaskPayload.class));
        } catch (JsonProcessingException err) {
            //  an unreadable entry is dropped, otherwise it would block the queue forever
            log.error("Dropping malformed analysis task: {}", json, err);
            return Optional.empty();
        }
    }

    //  interrupts pings still in flight
    @PreDestroy
    public void shutdown() {
        pingExecutor.shutdownNow();
    }
}
