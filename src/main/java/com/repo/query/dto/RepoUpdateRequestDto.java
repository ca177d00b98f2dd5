package com.repo.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class RepoUpdateRequestDto {
    public static final String ACTION_REANALYZE = "reanalyze";

    private String name;
    private String branch;
    //  "reanalyze" triggers a new analysis run
    private String action;
}
