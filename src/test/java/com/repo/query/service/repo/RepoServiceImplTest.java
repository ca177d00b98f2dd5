package com.repo.query.service.repo;

import com.repo.query.config.Common;
import com.repo.query.dto.*;
import com.repo.query.exception.ConflictException;
import com.repo.query.exception.ResourceNotFoundException;
import com.repo.query.model.job.AnalysisJob;
import com.repo.query.model.job.AnalysisJobRepository;
import com.repo.query.model.job.JobStatus;
import com.repo.query.model.question.QuestionRepository;
import com.repo.query.model.repo.ChunkType;
import com.repo.query.model.repo.CodeChunkRepository;
import com.repo.query.model.repo.Repo;
import com.repo.query.model.repo.RepoRepository;
import com.repo.query.model.repo.RepoStatus;
import com.repo.query.service.queue.AnalysisDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepoServiceImplTest {

    @Mock
    private RepoRepository repoRepository;

    @Mock
    private CodeChunkRepository codeChunkRepository;

    @Mock
    private QuestionRepository questionRepository;

    @Mock
    private AnalysisJobRepository jobRepository;

    @Mock
    private AnalysisDispatcher analysisDispatcher;

    private RepoServiceImpl repoService;

    @BeforeEach
    void setUp() {
        lenient().when(repoRepository.save(any(Repo.class))).thenAnswer(invocation -> invocation.getArgument(0));
        repoService = new RepoServiceImpl(repoRepository, codeChunkRepository, questionRepository,
                jobRepository, analysisDispatcher, new Common().modelMapper(),
                new TransactionTemplate(mock(PlatformTransactionManager.class)));
    }

    @Test
    void createRegistersPendingRepositoryAndQueuesAnalysis() {
        when(repoRepository.findByRepoUrl("https://github.com/acme/widgets/")).thenReturn(Optional.empty());
        when(repoRepository.save(any(Repo.class))).thenAnswer(invocation -> {
            Repo repo = invocation.getArgument(0);
            repo.setId(5L);
            return repo;
        });
        when(jobRepository.save(any(AnalysisJob.class))).thenAnswer(invocation -> {
            AnalysisJob job = invocation.getArgument(0);
            job.setId(50L);
            return job;
        });
        when(analysisDispatcher.dispatch(5L, 50L)).thenReturn(AnalysisDispatcher.LOCAL_TASK_ID);

        RepoResponseDto response = repoService.create(RepoCreateRequestDto.builder()
                .repoUrl("https://github.com/acme/widgets/")
                .build());

        assertThat(response.getId()).isEqualTo(5L);
        assertThat(response.getName()).isEqualTo("widgets");
        assertThat(response.getBranch()).isEqualTo("main");
        assertThat(response.getStatus()).isEqualTo(RepoStatus.PENDING);
        assertThat(response.getJobId()).isEqualTo(AnalysisDispatcher.LOCAL_TASK_ID);
        assertThat(response.getMessage()).isEqualTo("Repository analysis job queued");

        ArgumentCaptor<AnalysisJob> job = ArgumentCaptor.forClass(AnalysisJob.class);
        verify(jobRepository).save(job.capture());
        assertThat(job.getValue().getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getValue().getRepositoryId()).isEqualTo(5L);
        verify(jobRepository).assignTaskId(50L, AnalysisDispatcher.LOCAL_TASK_ID);
    }

    @Test
    void duplicateUrlIsAConflict() {
        when(repoRepository.findByRepoUrl("https://github.com/acme/widgets"))
                .thenReturn(Optional.of(Repo.builder().id(3L).build()));

        assertThatThrownBy(() -> repoService.create(RepoCreateRequestDto.builder()
                .repoUrl("https://github.com/acme/widgets")
                .build()))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("id 3");
        verify(analysisDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void blankUrlIsRejected() {
        assertThatThrownBy(() -> repoService.create(RepoCreateRequestDto.builder().repoUrl("  ").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nameIsTheLastUrlSegment() {
        assertThat(RepoServiceImpl.nameFromUrl("https://github.com/acme/widgets")).isEqualTo("widgets");
        assertThat(RepoServiceImpl.nameFromUrl("https://github.com/acme/widgets.git//")).isEqualTo("widgets.git");
        assertThat(RepoServiceImpl.nameFromUrl("widgets")).isEqualTo("widgets");
    }

    @Test
    void listFiltersByStatusAndLowerCasedSearch() {
        Repo ready = Repo.builder().id(1L).name("Widgets").repoUrl("u1").status(RepoStatus.READY).build();
        when(repoRepository.search(eq(RepoStatus.READY), eq("widg"), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(ready)));

        PagedResponseDto<RepoResponseDto> page = repoService.list("ready", "  WIDG ", 20, 0);

        assertThat(page.getTotal()).isEqualTo(1);
        assertThat(page.getItems()).extracting(RepoResponseDto::getName).containsExactly("Widgets");
    }

    @Test
    void listWithoutFiltersPassesNulls() {
        when(repoRepository.search(isNull(), isNull(), any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

        assertThat(repoService.list(null, "", 10, 0).getItems()).isEmpty();
    }

    @Test
    void listRejectsOutOfRangeLimit() {
        assertThatThrownBy(() -> repoService.list(null, null, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repoService.list(null, null, 101, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reanalyzeWhileAnalyzingIsAConflict() {
        Repo analyzing = Repo.builder().id(1L).name("w").repoUrl("u").status(RepoStatus.ANALYZING).build();
        when(repoRepository.findById(1L)).thenReturn(Optional.of(analyzing));
        when(repoRepository.resetForReanalysis(eq(1L), eq(RepoServiceImpl.REANALYZABLE), any(Instant.class))).thenReturn(0);

        assertThatThrownBy(() -> repoService.update(1L, RepoUpdateRequestDto.builder().action("reanalyze").build()))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("status: analyzing");
        verify(analysisDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void onlyOneOfTwoConcurrentReanalysisRequestsWins() {
        Repo ready = Repo.builder().id(1L).name("w").repoUrl("u").status(RepoStatus.READY).build();
        Repo pending = Repo.builder().id(1L).name("w").repoUrl("u").status(RepoStatus.PENDING).build();
        //  both requests read "ready", the second finds the row already reset
        when(repoRepository.findById(1L)).thenReturn(Optional.of(ready), Optional.of(pending));
        when(repoRepository.resetForReanalysis(eq(1L), eq(RepoServiceImpl.REANALYZABLE), any(Instant.class))).thenReturn(0);

        assertThatThrownBy(() -> repoService.update(1L, RepoUpdateRequestDto.builder().action("reanalyze").build()))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("status: pending");
        verify(jobRepository, never()).save(any(AnalysisJob.class));
        verify(analysisDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void reanalyzeFinishedRepositoryQueuesANewJob() {
        Repo ready = Repo.builder().id(1L).name("w").repoUrl("u").status(RepoStatus.READY).build();
        Repo reset = Repo.builder().id(1L).name("w").repoUrl("u").branch("develop").status(RepoStatus.PENDING).build();
        when(repoRepository.findById(1L)).thenReturn(Optional.of(ready), Optional.of(reset));
        when(repoRepository.resetForReanalysis(eq(1L), eq(RepoServiceImpl.REANALYZABLE), any(Instant.class))).thenReturn(1);
        when(jobRepository.save(any(AnalysisJob.class))).thenAnswer(invocation -> {
            AnalysisJob job = invocation.getArgument(0);
            job.setId(77L);
            return job;
        });
        when(analysisDispatcher.dispatch(1L, 77L)).thenReturn("9f1c");

        RepoResponseDto response = repoService.update(1L, RepoUpdateRequestDto.builder()
                .action("reanalyze")
                .branch("develop")
                .build());

        assertThat(ready.getBranch()).isEqualTo("develop");
        assertThat(response.getStatus()).isEqualTo(RepoStatus.PENDING);
        assertThat(response.getBranch()).isEqualTo("develop");
        assertThat(response.getJobId()).isEqualTo("9f1c");
        verify(repoRepository).save(ready);
        verify(jobRepository).assignTaskId(77L, "9f1c");
    }

    @Test
    void renameDoesNotStartAnalysis() {
        Repo ready = Repo.builder().id(1L).name("old").repoUrl("u").status(RepoStatus.READY).build();
        when(repoRepository.findById(1L)).thenReturn(Optional.of(ready));

        RepoResponseDto response = repoService.update(1L, RepoUpdateRequestDto.builder().name("new").build());

        assertThat(response.getName()).isEqualTo("new");
        assertThat(response.getJobId()).isNull();
        verify(repoRepository, never()).resetForReanalysis(any(), any(), any());
        verify(analysisDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void unknownActionIsRejected() {
        when(repoRepository.findById(1L)).thenReturn(Optional.of(Repo.builder().id(1L).build()));

        assertThatThrownBy(() -> repoService.update(1L, RepoUpdateRequestDto.builder().action("archive").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteRemovesEverythingOwnedByTheRepository() {
        when(repoRepository.findById(2L)).thenReturn(Optional.of(Repo.builder().id(2L).build()));
        when(codeChunkRepository.deleteByRepositoryId(2L)).thenReturn(120);
        when(questionRepository.deleteByRepositoryId(2L)).thenReturn(4);

        RepoDeleteResponseDto response = repoService.delete(2L);

        assertThat(response.getDeletedCodeChunks()).isEqualTo(120);
        assertThat(response.getDeletedQuestions()).isEqualTo(4);
        verify(jobRepository).deleteByRepositoryId(2L);
        verify(repoRepository).deleteById(2L);
    }

    @Test
    void missingRepositoryIsNotFound() {
        when(repoRepository.findById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> repoService.get(8L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void analysisStatusReportsTheLatestJob() {
        Instant started = Instant.parse("2026-01-01T10:00:00Z");
        AnalysisJob job = AnalysisJob.builder()
                .id(3L).repositoryId(1L).taskId("local-task")
                .status(JobStatus.PROCESSING).progressPercentage(40).startedAt(started)
                .build();
        when(jobRepository.findFirstByRepositoryIdOrderByCreatedAtDescIdDesc(1L)).thenReturn(Optional.of(job));

        AnalysisStatusDto status = repoService.analysisStatus(1L);

        assertThat(status.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(status.getProgressPercentage()).isEqualTo(40);
        assertThat(status.getJobId()).isEqualTo("local-task");
        assertThat(status.getStartedAt()).isEqualTo(started);
    }

    @Test
    void analysisStatusWithoutJobIsNotFound() {
        when(jobRepository.findFirstByRepositoryIdOrderByCreatedAtDescIdDesc(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> repoService.analysisStatus(1L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void statisticsCombineCodeAndUsage() {
        Repo repo = Repo.builder().id(1L).totalFiles(12).totalLines(900).languages(Map.of("python", 12)).build();
        when(repoRepository.findById(1L)).thenReturn(Optional.of(repo));
        when(codeChunkRepository.countByRepositoryIdAndChunkType(1L, ChunkType.FUNCTION)).thenReturn(30L);
        when(codeChunkRepository.countByRepositoryIdAndChunkType(1L, ChunkType.CLASS)).thenReturn(6L);
        when(questionRepository.countByRepositoryId(1L)).thenReturn(2L);
        when(questionRepository.averageProcessingTimeMs(1L)).thenReturn(1500.0);

        RepoStatisticsDto statistics = repoService.statistics(1L);

        assertThat(statistics.getCodeStatistics().getTotalFunctions()).isEqualTo(30);
        assertThat(statistics.getCodeStatistics().getTotalClasses()).isEqualTo(6);
        assertThat(statistics.getCodeStatistics().getLanguages()).containsEntry("python", 12);
        assertThat(statistics.getUsageStatistics().getTotalQuestionsAsked()).isEqualTo(2);
        assertThat(statistics.getUsageStatistics().getAverageResponseTimeMs()).isEqualTo(1500.0);
    }
}
