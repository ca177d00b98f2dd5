package com.repo.query.service.retrieval;

import com.repo.query.model.repo.ChunkMatch;
import com.repo.query.model.repo.ChunkType;
import com.repo.query.model.repo.CodeChunkRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VectorRetrievalServiceTest {

    @Mock
    private CodeChunkRepository codeChunkRepository;

    @InjectMocks
    private VectorRetrievalService retrievalService;

    @Test
    void returnsMostSimilarFirstWithTiesByLowerId() {
        float[] query = {1f, 0f};
        when(codeChunkRepository.findNearestByRepo(eq(7L), any(float[].class), eq(5))).thenReturn(List.of(
                match(12L, 0.50),
                match(4L, 0.91),
                match(9L, 0.50)));

        List<RetrievedChunk> chunks = retrievalService.retrieve(7L, query, 5);

        assertThat(chunks).extracting(RetrievedChunk::getId).containsExactly(4L, 9L, 12L);
        assertThat(chunks.get(0).getChunkType()).isEqualTo(ChunkType.FUNCTION);
        assertThat(chunks.get(0).getFilePath()).isEqualTo("src/chunk4.py");
    }

    @Test
    void fewerChunksThanRequestedAreAllReturned() {
        when(codeChunkRepository.findNearestByRepo(anyLong(), any(float[].class), anyInt()))
                .thenReturn(List.of(match(1L, 0.8), match(2L, 0.7), match(3L, 0.6)));

        assertThat(retrievalService.retrieve(1L, new float[]{1f}, 5)).hasSize(3);
    }

    @Test
    void emptyRepositoryIsNotAnError() {
        when(codeChunkRepository.findNearestByRepo(anyLong(), any(float[].class), anyInt())).thenReturn(List.of());

        assertThat(retrievalService.retrieve(1L, new float[]{1f}, 5)).isEmpty();
    }

    @Test
    void undefinedSimilarityCountsAsZero() {
        when(codeChunkRepository.findNearestByRepo(anyLong(), any(float[].class), anyInt()))
                .thenReturn(List.of(match(3L, Double.NaN), match(8L, 0.4)));

        List<RetrievedChunk> chunks = retrievalService.retrieve(1L, new float[]{1f}, 5);

        assertThat(chunks).extracting(RetrievedChunk::getId).containsExactly(8L, 3L);
        assertThat(chunks.get(1).getSimilarity()).isEqualTo(0.0);
    }

    @Test
    void nonPositiveKReturnsNothing() {
        assertThat(retrievalService.retrieve(1L, new float[]{1f}, 0)).isEmpty();
        verifyNoInteractions(codeChunkRepository);
    }

    private static ChunkMatch match(Long id, double similarity) {
        return new ChunkMatch() {
            @Override
            public Long getId() {
                return id;
            }

            @Override
            public String getFilePath() {
                return "src/chunk" + id + ".py";
            }

            @Override
            public String getChunkText() {
                return "def f" + id + "(): pass";
            }

            @Override
            public String getChunkType() {
                return "FUNCTION";
            }

            @Override
            public Integer getLineStart() {
                return 1;
            }

            @Override
            public Integer getLineEnd() {
                return 2;
            }

            @Override
            public String getLanguage() {
                return "python";
            }

            @Override
            public Double getSimilarity() {
                return similarity;
            }
        };
    }
}
