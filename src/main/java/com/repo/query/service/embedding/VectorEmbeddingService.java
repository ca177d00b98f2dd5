package com.repo.query.service.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * turns text into unit-length vectors of the configured dimension, so cosine similarity is a dot product
 */
@Slf4j
@Service
public class VectorEmbeddingService {
    private final EmbeddingModelLoader modelLoader;
    private final int batchSize;
    private final int maxRetries;
    private final long retryBackoffMs;

    public VectorEmbeddingService(
            EmbeddingModelLoader modelLoader,
            @Value("${query.embedding.batch-size:64}") int batchSize,
            @Value("${query.embedding.max-retries:3}") int maxRetries,
            @Value("${query.embedding.retry-backoff-ms:5000}") long retryBackoffMs
    ) {
        if (batchSize < 1) throw new IllegalArgumentException("Embedding batch size must be at least 1");
        this.modelLoader = modelLoader;
        this.batchSize = batchSize;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
    }

    /**
     * embeds a single text
     *
     * @param text
     * @return
     */
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    /**
     * embeds texts in fixed-size batches to bound peak memory. The result is in input order.
     *
     * @param texts
     * @return one vector per text
     */
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();

        EmbeddingModel model = modelLoader.get();
        int totalBatches = (texts.size() + batchSize - 1) / batchSize;
        log.info("Generating embeddings for {} texts in {} batch(es)", texts.size(), totalBatches);

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(start + batchSize, texts.size()));
            int batchNumber = start / batchSize + 1;

            List<float[]> embedded = embedWithRetry(model, batch, batchNumber);
            if (embedded.size() != batch.size())
                throw new IllegalStateException("Embedding batch " + batchNumber + " returned "
                        + embedded.size() + " vectors for " + batch.size() + " texts");

            for (float[] vector : embedded) {
                vectors.add(normalize(checkDimension(vector)));
            }
            log.debug("Embedded batch {}/{}", batchNumber, totalBatches);
        }
        return vectors;
    }

    public int dimension() {
        return modelLoader.dimension();
    }

    /**
     * scales a vector to L2 norm 1.
     *
     * @param vector
     * @return a new array
     * @throws IllegalStateException for the zero vector or one holding NaN/infinite components, neither has a direction
     */
    public static float[] normalize(float[] vector) {
        double sumOfSquares = 0;
        for (float v : vector) sumOfSquares += (double) v * v;

        double norm = Math.sqrt(sumOfSquares);
        if (norm == 0 || !Double.isFinite(norm))
            throw new IllegalStateException("Embedding cannot be normalized, its norm is " + norm);

        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / norm);
        }
        return normalized;
    }

    private float[] checkDimension(float[] vector) {
        if (vector == null || vector.length != modelLoader.dimension())
            throw new IllegalStateException("Embedding has " + (vector == null ? 0 : vector.length)
                    + " dimensions, expected " + modelLoader.dimension());
        return vector;
    }

    /**
     * calls the model with a linear backoff between attempts to ride out transient backend failures
     *
     * @param model
     * @param batch
     * @param batchNumber
     * @return
     */
    private List<float[]> embedWithRetry(EmbeddingModel model, List<String> batch, int batchNumber) {
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return model.embed(batch);
            } catch (RuntimeException err) {
                lastException = err;
                if (attempt == maxRetries) break;

                long waitTime = retryBackoffMs * attempt;
                log.warn("Embedding generation failed for batch {}, attempt {}/{}. Waiting {}ms before retry...",
                        batchNumber, attempt, maxRetries, waitTime);
                if (!sleep(waitTime)) break;
            }
        }

        throw new IllegalStateException("Failed to generate embeddings after " + maxRetries + " attempts", lastException);
    }

    private boolean sleep(long millis) {
        if (millis == 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            //  restore the interrupted status and stop retrying
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
