package com.repo.query.service.chunk;

import com.repo.query.model.repo.ChunkType;
import lombok.Builder;
import lombok.Value;

/**
 * a chunk as produced by the chunking engine, before it is embedded and persisted.
 * line numbers are 1-based and inclusive.
 */
@Value
@Builder
public class ChunkData {
    String filePath;
    String chunkText;
    ChunkType chunkType;
    int lineStart;
    int lineEnd;
    String language;
}
