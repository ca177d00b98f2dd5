package com.repo.query.service.retrieval;

import com.repo.query.model.repo.ChunkMatch;
import com.repo.query.model.repo.ChunkType;
import com.repo.query.model.repo.CodeChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class VectorRetrievalService {
    //  most similar first, equal similarity by lower chunk id
    static final Comparator<RetrievedChunk> BY_RELEVANCE = Comparator
            .comparingDouble(RetrievedChunk::getSimilarity).reversed()
            .thenComparing(RetrievedChunk::getId);

    private final CodeChunkRepository codeChunkRepository;

    /**
     * returns up to k embedded chunks of the repository closest to the query vector.
     * An empty repository is a normal outcome and yields an empty list.
     *
     * @param repositoryId
     * @param queryVector unit-length query embedding
     * @param k
     * @return chunks ordered by descending similarity
     */
    public List<RetrievedChunk> retrieve(Long repositoryId, float[] queryVector, int k) {
        if (k <= 0) return List.of();

        List<ChunkMatch> matches = codeChunkRepository.findNearestByRepo(repositoryId, queryVector, k);
        log.debug("Retrieved {} chunk(s) for repository {}", matches.size(), repositoryId);

        return matches.stream()
                .map(this::toRetrievedChunk)
                .sorted(BY_RELEVANCE)
                .limit(k)
                .toList();
    }

    private RetrievedChunk toRetrievedChunk(ChunkMatch match) {
        return RetrievedChunk.builder()
                .id(match.getId())
                .filePath(match.getFilePath())
                .chunkText(match.getChunkText())
                .chunkType(match.getChunkType() == null ? null : ChunkType.valueOf(match.getChunkType()))
                .lineStart(match.getLineStart() == null ? 0 : match.getLineStart())
                .lineEnd(match.getLineEnd() == null ? 0 : match.getLineEnd())
                .language(match.getLanguage())
                .similarity(similarity(match.getSimilarity()))
                .build();
    }

    //  pgvector yields NaN for a zero-norm operand; such a row carries no similarity
    static double similarity(Double value) {
        return value == null || !Double.isFinite(value) ? 0.0 : value;
    }
}
