package com.repo.query.service.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * loads the embedding model on first use, exactly once per process.
 * Loading means a warmup call that forces the backend to bring the model into memory;
 * concurrent first callers wait for the single load instead of triggering their own.
 */
@Slf4j
@Component
public class EmbeddingModelLoader {
    private static final String WARMUP_TEXT = "model warmup test";

    private final EmbeddingModel embeddingModel;
    private final int dimension;
    private final Object loadLock = new Object();
    private volatile EmbeddingModel loaded;

    public EmbeddingModelLoader(
            EmbeddingModel embeddingModel,
            @Value("${query.embedding.dimension:768}") int dimension
    ) {
        this.embeddingModel = embeddingModel;
        this.dimension = dimension;
    }

    /**
     * returns the ready model, loading it if this is the first call.
     * A failed load is not cached, the next caller tries again.
     *
     * @return
     */
    public EmbeddingModel get() {
        EmbeddingModel model = loaded;
        if (model != null) return model;

        synchronized (loadLock) {
            if (loaded == null) {
                long start = System.currentTimeMillis();
                log.info("Loading embedding model...");
                float[] warmup = embeddingModel.embed(WARMUP_TEXT);
                if (warmup == null || warmup.length != dimension)
                    throw new IllegalStateException("Embedding model returned " + (warmup == null ? 0 : warmup.length)
                            + " dimensions, expected " + dimension);
                loaded = embeddingModel;
                log.info("Embedding model loaded in {}ms", System.currentTimeMillis() - start);
            }
            return loaded;
        }
    }

    public boolean isLoaded() {
        return loaded != null;
    }

    public int dimension() {
        return dimension;
    }
}
