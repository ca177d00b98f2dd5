package com.repo.query.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.repo.query.model.repo.RepoStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RepoResponseDto {
    private Long id;
    private String name;
    private String repoUrl;
    private String branch;
    private RepoStatus status;
    private String description;
    private int totalFiles;
    private long totalLines;
    private Map<String, Integer> languages;
    private Instant analyzedAt;
    private Instant createdAt;
    private Instant updatedAt;

    //  only set on create / update responses
    private String message;
    private String jobId;
}
