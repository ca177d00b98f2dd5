package com.repo.query.service.repo;

import com.repo.query.dto.*;

public interface RepoService {
    RepoResponseDto create(RepoCreateRequestDto request);

    PagedResponseDto<RepoResponseDto> list(String status, String search, int limit, long offset);

    RepoResponseDto get(Long repositoryId);

    RepoResponseDto update(Long repositoryId, RepoUpdateRequestDto request);

    RepoDeleteResponseDto delete(Long repositoryId);

    AnalysisStatusDto analysisStatus(Long repositoryId);

    RepoStatisticsDto statistics(Long repositoryId);
}
