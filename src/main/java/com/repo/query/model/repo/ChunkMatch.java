package com.repo.query.model.repo;

/**
 * projection of a similarity search row: the chunk columns plus its cosine similarity to the query
 */
public interface ChunkMatch {
    Long getId();

    String getFilePath();

    String getChunkText();

    String getChunkType();

    Integer getLineStart();

    Integer getLineEnd();

    String getLanguage();

    Double getSimilarity();
}
