package com.repo.query.service.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisTaskPayload {
    private String taskId;
    private Long repositoryId;
    private Long jobId;
}
