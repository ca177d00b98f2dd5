package com.repo.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class RepoDeleteResponseDto {
    private String message;
    private Long repositoryId;
    private long deletedCodeChunks;
    private long deletedQuestions;
}
