package com.repo.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class RepoCreateRequestDto {
    private String repoUrl;
    @Builder.Default
    private String branch = "main";
    private String name;
}
