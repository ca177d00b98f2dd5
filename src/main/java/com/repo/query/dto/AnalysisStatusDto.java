package com.repo.query.dto;

import com.repo.query.model.job.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class AnalysisStatusDto {
    private Long repositoryId;
    private JobStatus status;
    private String jobId;
    private int progressPercentage;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
}
