package com.repo.query.service.pipeline;

import com.repo.query.exception.PipelineFailureException;
import com.repo.query.model.job.AnalysisJob;
import com.repo.query.model.job.AnalysisJobRepository;
import com.repo.query.model.job.JobStatus;
import com.repo.query.model.repo.ChunkType;
import com.repo.query.model.repo.CodeChunk;
import com.repo.query.model.repo.CodeChunkRepository;
import com.repo.query.model.repo.Repo;
import com.repo.query.model.repo.RepoRepository;
import com.repo.query.model.repo.RepoStatus;
import com.repo.query.service.chunk.ChunkingService;
import com.repo.query.service.embedding.VectorEmbeddingService;
import com.repo.query.service.queue.AnalysisDispatcher;
import com.repo.query.service.repo.GitIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisPipelineServiceTest {
    private static final Long REPO_ID = 1L;
    private static final Long JOB_ID = 10L;

    @TempDir
    Path checkout;

    @Mock
    private RepoRepository repoRepository;

    @Mock
    private AnalysisJobRepository jobRepository;

    @Mock
    private CodeChunkRepository codeChunkRepository;

    @Mock
    private GitIngestionService gitIngestionService;

    @Mock
    private VectorEmbeddingService embeddingService;

    private Repo repo;
    private AnalysisJob job;
    private final List<Integer> savedProgress = new ArrayList<>();
    private AnalysisPipelineService pipelineService;

    @BeforeEach
    void setUp() {
        repo = Repo.builder().id(REPO_ID).name("demo").repoUrl("https://example.com/demo.git").branch("main").build();
        job = AnalysisJob.builder().id(JOB_ID).repositoryId(REPO_ID).build();

        lenient().when(repoRepository.findById(REPO_ID)).thenReturn(Optional.of(repo));
        lenient().when(repoRepository.save(any(Repo.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));
        lenient().when(jobRepository.findFirstByRepositoryIdOrderByCreatedAtDescIdDesc(REPO_ID)).thenReturn(Optional.of(job));
        lenient().when(jobRepository.save(any(AnalysisJob.class))).thenAnswer(invocation -> {
            AnalysisJob saved = invocation.getArgument(0);
            savedProgress.add(saved.getProgressPercentage());
            return saved;
        });
        lenient().when(embeddingService.embedBatch(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) vectors.add(new float[]{1f, 0f});
            return vectors;
        });

        TransactionTemplate transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
        pipelineService = new AnalysisPipelineService(repoRepository, jobRepository, codeChunkRepository,
                gitIngestionService, new ChunkingService(50), embeddingService, transactionTemplate);
    }

    @Test
    void runsAllStagesAndMarksRepositoryReady() throws IOException {
        Path python = write("src/app.py", "def main():\n    print('hi')\n");
        Path java = write("src/Greeter.java", "class Greeter {\n    void greet() {}\n}");
        when(gitIngestionService.cloneRepository(repo.getRepoUrl(), "main")).thenReturn(checkout);
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of(java, python));

        pipelineService.run(REPO_ID, JOB_ID, "task-1");

        assertThat(savedProgress).containsExactly(0, 10, 20, 40, 60, 85, 100);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getTaskId()).isEqualTo("task-1");
        assertThat(job.getCompletedAt()).isNotNull();

        assertThat(repo.getStatus()).isEqualTo(RepoStatus.READY);
        assertThat(repo.getTotalFiles()).isEqualTo(2);
        assertThat(repo.getLanguages()).isEqualTo(Map.of("java", 1, "python", 1));
        assertThat(repo.getAnalyzedAt()).isNotNull();

        ArgumentCaptor<List<CodeChunk>> stored = captureStoredChunks();
        assertThat(stored.getValue())
                .extracting(CodeChunk::getChunkType)
                .containsExactly(ChunkType.BLOCK, ChunkType.FUNCTION);
        assertThat(stored.getValue()).allSatisfy(chunk -> {
            assertThat(chunk.getRepositoryId()).isEqualTo(REPO_ID);
            assertThat(chunk.getEmbedding()).hasSize(2);
        });
        //  java window 1-3, python function 1-2
        assertThat(repo.getTotalLines()).isEqualTo(5);
        verify(repoRepository).updateStatus(eq(REPO_ID), eq(RepoStatus.ANALYZING), any(Instant.class));

        verify(codeChunkRepository).deleteByRepositoryId(REPO_ID);
        verify(gitIngestionService).cleanup(checkout);
    }

    @Test
    void editsMadeDuringTheRunAreKept() {
        Repo renamed = Repo.builder().id(REPO_ID).name("renamed").repoUrl(repo.getRepoUrl())
                .branch("develop").status(RepoStatus.ANALYZING).build();
        //  first read starts the run, the second one finishes it after a rename landed
        when(repoRepository.findById(REPO_ID)).thenReturn(Optional.of(repo), Optional.of(renamed));
        when(gitIngestionService.cloneRepository(any(), any())).thenReturn(checkout);
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of());

        pipelineService.run(REPO_ID, JOB_ID, "task-1");

        verify(repoRepository).save(renamed);
        verify(repoRepository, never()).save(repo);
        assertThat(renamed.getStatus()).isEqualTo(RepoStatus.READY);
        assertThat(renamed.getName()).isEqualTo("renamed");
        assertThat(renamed.getBranch()).isEqualTo("develop");
    }

    @Test
    void repositoryDeletedDuringTheRunFailsTheJob() {
        when(repoRepository.findById(REPO_ID)).thenReturn(Optional.of(repo), Optional.empty());
        when(gitIngestionService.cloneRepository(any(), any())).thenReturn(checkout);
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of());

        assertThatThrownBy(() -> pipelineService.run(REPO_ID, JOB_ID, "task-1"))
                .hasMessageContaining("deleted during analysis");
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        verify(gitIngestionService).cleanup(checkout);
    }

    @Test
    void createsAJobWhenNoneWasQueued() {
        when(gitIngestionService.cloneRepository(any(), any())).thenReturn(checkout);
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of());

        pipelineService.run(REPO_ID, null, "local-task");

        ArgumentCaptor<AnalysisJob> saved = ArgumentCaptor.forClass(AnalysisJob.class);
        verify(jobRepository, atLeastOnce()).save(saved.capture());
        AnalysisJob created = saved.getAllValues().get(0);
        assertThat(created).isNotSameAs(job);
        assertThat(created.getRepositoryId()).isEqualTo(REPO_ID);
        assertThat(created.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(repo.getStatus()).isEqualTo(RepoStatus.READY);
        assertThat(repo.getTotalFiles()).isZero();
    }

    @Test
    void cloneFailureMarksRepositoryAndJobFailed() {
        when(gitIngestionService.cloneRepository(any(), any()))
                .thenThrow(new PipelineFailureException("Failed to clone repository: not found"));

        assertThatThrownBy(() -> pipelineService.run(REPO_ID, JOB_ID, "task-1"))
                .isInstanceOf(PipelineFailureException.class)
                .hasMessage("Failed to clone repository: not found");

        assertThat(repo.getStatus()).isEqualTo(RepoStatus.FAILED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Failed to clone repository: not found");
        assertThat(job.getProgressPercentage()).isEqualTo(10);
        verify(gitIngestionService).cleanup(null);
        verify(codeChunkRepository, never()).saveAll(anyList());
    }

    @Test
    void embeddingFailureStillReleasesTheClone() throws IOException {
        Path python = write("app.py", "x = 1\n");
        when(gitIngestionService.cloneRepository(any(), any())).thenReturn(checkout);
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of(python));
        when(embeddingService.embedBatch(anyList())).thenThrow(new IllegalStateException("embedding backend down"));

        assertThatThrownBy(() -> pipelineService.run(REPO_ID, JOB_ID, "task-1"))
                .hasMessage("embedding backend down");

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getProgressPercentage()).isEqualTo(60);
        assertThat(repo.getStatus()).isEqualTo(RepoStatus.FAILED);
        verify(gitIngestionService).cleanup(checkout);
    }

    @Test
    void rerunReplacesPreviousChunks() throws IOException {
        Path python = write("app.py", "x = 1\n");
        when(gitIngestionService.cloneRepository(any(), any())).thenReturn(checkout);
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of(python));

        pipelineService.run(REPO_ID, JOB_ID, "task-1");
        job = AnalysisJob.builder().id(11L).repositoryId(REPO_ID).build();
        when(jobRepository.findById(11L)).thenReturn(Optional.of(job));
        pipelineService.run(REPO_ID, 11L, "task-2");

        ArgumentCaptor<List<CodeChunk>> stored = captureStoredChunks(2);
        assertThat(stored.getAllValues().get(0)).hasSameSizeAs(stored.getAllValues().get(1));
        verify(codeChunkRepository, times(2)).deleteByRepositoryId(REPO_ID);
    }

    @Test
    void concurrentRunsAreSerialized() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger mostActive = new AtomicInteger();
        CountDownLatch firstCloning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(gitIngestionService.cloneRepository(any(), any())).thenAnswer(invocation -> {
            mostActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            firstCloning.countDown();
            release.await(5, TimeUnit.SECONDS);
            active.decrementAndGet();
            return checkout;
        });
        when(gitIngestionService.discoverFiles(checkout)).thenReturn(List.of());

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = callers.submit(() -> pipelineService.run(REPO_ID, null, "queue-task"));
            assertThat(firstCloning.await(5, TimeUnit.SECONDS)).isTrue();
            Future<?> second = callers.submit(() -> pipelineService.run(REPO_ID, null, AnalysisDispatcher.LOCAL_TASK_ID));

            //  the second caller is parked on the lock, not cloning
            assertThatThrownBy(() -> second.get(300, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
            release.countDown();
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertThat(mostActive.get()).isEqualTo(1);
        verify(gitIngestionService, times(2)).cloneRepository(any(), any());
    }

    @Test
    void missingRepositoryIsRaised() {
        when(repoRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> pipelineService.run(99L, null, "task-1"))
                .hasMessageContaining("Repository 99 not found");
        verify(gitIngestionService, never()).cloneRepository(any(), any());
    }

    private ArgumentCaptor<List<CodeChunk>> captureStoredChunks() {
        return captureStoredChunks(1);
    }

    @SuppressWarnings("unchecked")
    private ArgumentCaptor<List<CodeChunk>> captureStoredChunks(int calls) {
        ArgumentCaptor<List<CodeChunk>> captor = ArgumentCaptor.forClass(List.class);
        verify(codeChunkRepository, times(calls)).saveAll(captor.capture());
        return captor;
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = checkout.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
