package com.repo.query.service.retrieval;

import com.repo.query.model.repo.ChunkType;
import lombok.Builder;
import lombok.Value;

/**
 * a stored chunk together with its cosine similarity to the query
 */
@Value
@Builder
public class RetrievedChunk {
    Long id;
    String filePath;
    String chunkText;
    ChunkType chunkType;
    int lineStart;
    int lineEnd;
    String language;
    double similarity;
}
