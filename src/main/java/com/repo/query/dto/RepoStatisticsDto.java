package com.repo.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class RepoStatisticsDto {
    private Long repositoryId;
    private CodeStatistics codeStatistics;
    private UsageStatistics usageStatistics;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    @Builder
    public static class CodeStatistics {
        private int totalFiles;
        private long totalLines;
        private long totalFunctions;
        private long totalClasses;
        private Map<String, Integer> languages;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    @Builder
    public static class UsageStatistics {
        private long totalQuestionsAsked;
        private Double averageResponseTimeMs;
    }
}
