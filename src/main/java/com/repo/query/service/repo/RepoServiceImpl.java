package com.repo.query.service.repo;

import com.repo.query.dto.*;
import com.repo.query.exception.ConflictException;
import com.repo.query.exception.ResourceNotFoundException;
import com.repo.query.model.OffsetPageRequest;
import com.repo.query.model.job.AnalysisJob;
import com.repo.query.model.job.AnalysisJobRepository;
import com.repo.query.model.question.QuestionRepository;
import com.repo.query.model.repo.ChunkType;
import com.repo.query.model.repo.CodeChunkRepository;
import com.repo.query.model.repo.Repo;
import com.repo.query.model.repo.RepoRepository;
import com.repo.query.model.repo.RepoStatus;
import com.repo.query.service.queue.AnalysisDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RepoServiceImpl implements RepoService {
    static final int MAX_PAGE_SIZE = 100;
    static final Set<RepoStatus> REANALYZABLE = EnumSet.of(RepoStatus.READY, RepoStatus.FAILED);

    private final RepoRepository repoRepository;
    private final CodeChunkRepository codeChunkRepository;
    private final QuestionRepository questionRepository;
    private final AnalysisJobRepository jobRepository;
    private final AnalysisDispatcher analysisDispatcher;
    private final ModelMapper modelMapper;
    private final TransactionTemplate transactionTemplate;

    /**
     * registers a repository and queues its first analysis.
     * The rows are committed before dispatch so a worker always finds them.
     *
     * @param request
     * @return the pending repository with the dispatch task id
     */
    @Override
    public RepoResponseDto create(RepoCreateRequestDto request) {
        String repoUrl = request.getRepoUrl() == null ? "" : request.getRepoUrl().trim();
        if (repoUrl.isEmpty()) throw new IllegalArgumentException("Repository url is required");

        repoRepository.findByRepoUrl(repoUrl).ifPresent(existing -> {
            throw new ConflictException("Repository already exists with id " + existing.getId());
        });

        String branch = isBlank(request.getBranch()) ? "main" : request.getBranch().trim();
        String name = isBlank(request.getName()) ? nameFromUrl(repoUrl) : request.getName().trim();

        Repo repo = repoRepository.save(Repo.builder()
                .name(name)
                .repoUrl(repoUrl)
                .branch(branch)
                .build());
        log.info("Registered repository {} ({}) on branch {}", repo.getId(), repoUrl, branch);

        RepoResponseDto response = toDto(repo);
        response.setJobId(requestAnalysis(repo.getId()));
        response.setMessage("Repository analysis job queued");
        return response;
    }

    @Override
    @Transactional(readOnly = true)
    public PagedResponseDto<RepoResponseDto> list(String status, String search, int limit, long offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE)
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE);
        if (offset < 0) throw new IllegalArgumentException("Offset must not be negative");

        RepoStatus statusFilter = isBlank(status) ? null : RepoStatus.fromValue(status);
        String searchFilter = isBlank(search) ? null : search.trim().toLowerCase();

        Page<Repo> page = repoRepository.search(statusFilter, searchFilter, new OffsetPageRequest(offset, limit));
        return PagedResponseDto.<RepoResponseDto>builder()
                .total(page.getTotalElements())
                .limit(limit)
                .offset(offset)
                .items(page.getContent().stream().map(this::toDto).toList())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public RepoResponseDto get(Long repositoryId) {
        return toDto(findRepo(repositoryId));
    }

    /**
     * renames, re-points or re-analyzes a repository.
     * Re-analysis is only accepted once the previous run has finished; the status check and the
     * reset are a single conditional update, so concurrent requests start at most one run.
     *
     * @param repositoryId
     * @param request
     * @return
     */
    @Override
    public RepoResponseDto update(Long repositoryId, RepoUpdateRequestDto request) {
        String action = isBlank(request.getAction()) ? null : request.getAction().trim().toLowerCase();

        //  committed before dispatch so the run sees the new branch and the pending status
        RepoResponseDto response = transactionTemplate.execute(status -> {
            Repo repo = findRepo(repositoryId);
            if (action != null && !RepoUpdateRequestDto.ACTION_REANALYZE.equals(action))
                throw new IllegalArgumentException("Unknown action: " + request.getAction());

            if (!isBlank(request.getName())) repo.setName(request.getName().trim());
            if (!isBlank(request.getBranch())) repo.setBranch(request.getBranch().trim());
            repo = repoRepository.save(repo);
            if (action == null) return toDto(repo);

            if (repoRepository.resetForReanalysis(repositoryId, REANALYZABLE, Instant.now()) == 0)
                throw new ConflictException("Repository " + repositoryId + " is already being analyzed (status: "
                        + findRepo(repositoryId).getStatus().value() + ")");
            return toDto(findRepo(repositoryId));
        });

        if (action == null) {
            response.setMessage("Repository updated");
            return response;
        }

        response.setJobId(requestAnalysis(repositoryId));
        response.setMessage("Re-analysis job queued");
        return response;
    }

    /**
     * removes the repository with its chunks, questions and jobs
     *
     * @param repositoryId
     * @return counts of what was removed
     */
    @Override
    @Transactional
    public RepoDeleteResponseDto delete(Long repositoryId) {
        Repo repo = findRepo(repositoryId);

        int chunks = codeChunkRepository.deleteByRepositoryId(repositoryId);
        int questions = questionRepository.deleteByRepositoryId(repositoryId);
        int jobs = jobRepository.deleteByRepositoryId(repositoryId);
        repoRepository.deleteById(repo.getId());
        log.info("Deleted repository {}: {} chunks, {} questions, {} jobs", repositoryId, chunks, questions, jobs);

        return RepoDeleteResponseDto.builder()
                .message("Repository deleted successfully")
                .repositoryId(repositoryId)
                .deletedCodeChunks(chunks)
                .deletedQuestions(questions)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public AnalysisStatusDto analysisStatus(Long repositoryId) {
        AnalysisJob job = jobRepository.findFirstByRepositoryIdOrderByCreatedAtDescIdDesc(repositoryId)
                .orElseThrow(() -> new ResourceNotFoundException("No analysis job found for repository " + repositoryId));

        return AnalysisStatusDto.builder()
                .repositoryId(repositoryId)
                .status(job.getStatus())
                .jobId(job.getTaskId())
                .progressPercentage(job.getProgressPercentage())
                .errorMessage(job.getErrorMessage())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public RepoStatisticsDto statistics(Long repositoryId) {
        Repo repo = findRepo(repositoryId);

        return RepoStatisticsDto.builder()
                .repositoryId(repositoryId)
                .codeStatistics(RepoStatisticsDto.CodeStatistics.builder()
                        .totalFiles(repo.getTotalFiles())
                        .totalLines(repo.getTotalLines())
                        .totalFunctions(codeChunkRepository.countByRepositoryIdAndChunkType(repositoryId, ChunkType.FUNCTION))
                        .totalClasses(codeChunkRepository.countByRepositoryIdAndChunkType(repositoryId, ChunkType.CLASS))
                        .languages(repo.getLanguages())
                        .build())
                .usageStatistics(RepoStatisticsDto.UsageStatistics.builder()
                        .totalQuestionsAsked(questionRepository.countByRepositoryId(repositoryId))
                        .averageResponseTimeMs(questionRepository.averageProcessingTimeMs(repositoryId))
                        .build())
                .build();
    }

    /**
     * creates the queued job for this request and hands the run to the dispatcher
     *
     * @param repositoryId
     * @return dispatch task id
     */
    private String requestAnalysis(Long repositoryId) {
        AnalysisJob job = jobRepository.save(AnalysisJob.builder().repositoryId(repositoryId).build());
        String taskId = analysisDispatcher.dispatch(repositoryId, job.getId());
        jobRepository.assignTaskId(job.getId(), taskId);
        return taskId;
    }

    private Repo findRepo(Long repositoryId) {
        return repoRepository.findById(repositoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Repository " + repositoryId + " not found"));
    }

    private RepoResponseDto toDto(Repo repo) {
        return modelMapper.map(repo, RepoResponseDto.class);
    }

    //  last path segment of the url, e.g. https://github.com/org/project/ -> project
    static String nameFromUrl(String repoUrl) {
        String trimmed = repoUrl.replaceAll("/+$", "");
        String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return name.isEmpty() ? repoUrl : name;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
