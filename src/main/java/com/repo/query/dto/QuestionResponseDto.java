package com.repo.query.dto;

import com.repo.query.model.question.SourceReference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class QuestionResponseDto {
    private Long questionId;
    private Long repositoryId;
    private String question;
    private String answer;
    private Double confidenceScore;
    private List<SourceReference> sources;
    private String modelUsed;
    private Long processingTimeMs;
    private boolean degraded;
    private Instant createdAt;
}
