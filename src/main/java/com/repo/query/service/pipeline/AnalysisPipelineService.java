package com.repo.query.service.pipeline;

import com.repo.query.exception.ResourceNotFoundException;
import com.repo.query.model.job.AnalysisJob;
import com.repo.query.model.job.AnalysisJobRepository;
import com.repo.query.model.job.JobStatus;
import com.repo.query.model.repo.CodeChunk;
import com.repo.query.model.repo.CodeChunkRepository;
import com.repo.query.model.repo.Repo;
import com.repo.query.model.repo.RepoRepository;
import com.repo.query.model.repo.RepoStatus;
import com.repo.query.service.chunk.ChunkData;
import com.repo.query.service.chunk.ChunkingService;
import com.repo.query.service.chunk.SourceLanguages;
import com.repo.query.service.embedding.VectorEmbeddingService;
import com.repo.query.service.repo.GitIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * one analysis run: clone -> discover -> chunk -> embed -> store.
 * Any failure marks the repository and its latest job failed and is rethrown to the dispatcher;
 * the clone directory is released on every exit path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisPipelineService {
    private final RepoRepository repoRepository;
    private final AnalysisJobRepository jobRepository;
    private final CodeChunkRepository codeChunkRepository;
    private final GitIngestionService gitIngestionService;
    private final ChunkingService chunkingService;
    private final VectorEmbeddingService embeddingService;
    private final TransactionTemplate transactionTemplate;

    //  queue worker, local executor and synchronous fallback all run through here; one run at a time
    private final ReentrantLock runLock = new ReentrantLock();

    /**
     * runs the whole pipeline for one repository. Waits while another run is in progress in this process.
     *
     * @param repositoryId
     * @param jobId job created when the request was accepted, or null to create one now
     * @param taskId dispatch task id recorded on the job
     */
    public void run(Long repositoryId, Long jobId, String taskId) {
        //  a second caller blocks until the current run has released the lock
        if (!runLock.tryLock()) {
            log.info("Repository {} (task {}) waits for the running analysis to finish", repositoryId, taskId);
            runLock.lock();
        }
        try {
            //  the actual pipeline, always under the lock
            analyze(repositoryId, jobId, taskId);
        } finally {
            runLock.unlock();
        }
    }

    private void analyze(Long repositoryId, Long jobId, String taskId) {
        log.info("Starting analysis of repository {} (task {})", repositoryId, taskId);
        Path cloneDir = null;

        try {
            //  load the repository, a missing one fails the run before any job is touched
            Repo repo = repoRepository.findById(repositoryId)
                    .orElseThrow(() -> new ResourceNotFoundException("Repository " + repositoryId + " not found"));

            //  adopt the queued job or create one, then report progress on it
            ProgressReporter progress = new JobProgressReporter(startJob(repositoryId, jobId, taskId), jobRepository);
            //  status only, the rest of the row may be edited while the run is going
            repoRepository.updateStatus(repositoryId, RepoStatus.ANALYZING, Instant.now());

            //  1. CLONE the configured branch into a fresh temp directory
            progress.report(PipelineStage.CLONING);
            cloneDir = gitIngestionService.cloneRepository(repo.getRepoUrl(), repo.getBranch());

            //  2. DISCOVER the supported source files, ignored directories pruned
            progress.report(PipelineStage.DISCOVERING);
            List<Path> codeFiles = gitIngestionService.discoverFiles(cloneDir);

            //  3. CHUNK every file, structural for python and windows for the rest
            progress.report(PipelineStage.CHUNKING);
            List<ChunkData> chunks = chunkFiles(codeFiles, cloneDir);

            //  4. EMBED all chunk texts, one vector per chunk in the same order
            progress.report(PipelineStage.EMBEDDING);
            List<float[]> embeddings = embeddingService.embedBatch(chunks.stream().map(ChunkData::getChunkText).toList());

            //  5. STORE the new chunks in place of the old ones
            progress.report(PipelineStage.STORING);
            storeChunks(repositoryId, chunks, embeddings);

            //  aggregates on the repository, job done at 100%
            finish(repositoryId, progress, codeFiles, chunks);
            log.info("Analysis complete for repository {}: {} files, {} chunks", repositoryId, codeFiles.size(), chunks.size());
        } catch (RuntimeException err) {
            //  record the failure on the repository and its job, then let the dispatcher see it
            log.error("Analysis failed for repository {}", repositoryId, err);
            markFailed(repositoryId, err);
            throw err;
        } finally {
            //  null-safe, nothing to remove when the clone never happened
            gitIngestionService.cleanup(cloneDir);
        }
    }

    /**
     * adopts the queued job created at accept time, or creates a fresh one
     *
     * @param repositoryId
     * @param jobId
     * @param taskId
     * @return the job, now processing at 0%
     */
    private AnalysisJob startJob(Long repositoryId, Long jobId, String taskId) {
        AnalysisJob job = null;
        //  only a queued job of this repository can be adopted
        if (jobId != null) {
            job = jobRepository.findById(jobId)
                    .filter(existing -> repositoryId.equals(existing.getRepositoryId()))
                    .filter(existing -> existing.getStatus() == JobStatus.QUEUED)
                    .orElse(null);
            if (job == null) log.warn("Job {} is not a queued job of repository {}, starting a new one", jobId, repositoryId);
        }
        //  direct runs and unusable job ids get a job of their own
        if (job == null) job = AnalysisJob.builder().repositoryId(repositoryId).build();

        //  processing at 0%, with the dispatch task id when there is one
        job.start();
        if (taskId != null) job.setTaskId(taskId);
        return jobRepository.save(job);
    }

    private List<ChunkData> chunkFiles(List<Path> codeFiles, Path root) {
        List<ChunkData> chunks = new ArrayList<>();
        //  files in path order, chunks in file order
        for (Path file : codeFiles) {
            chunks.addAll(chunkingService.chunk(file, root));
        }
        log.info("Total chunks: {}", chunks.size());
        return chunks;
    }

    /**
     * replaces the repository's chunks with the new ones in a single transaction
     *
     * @param repositoryId
     * @param chunks
     * @param embeddings one per chunk, same order
     */
    private void storeChunks(Long repositoryId, List<ChunkData> chunks, List<float[]> embeddings) {
        if (chunks.size() != embeddings.size())
            throw new IllegalStateException("Got " + embeddings.size() + " embeddings for " + chunks.size() + " chunks");

        //  build the entities outside the transaction, the embeddings are already computed
        List<CodeChunk> entities = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            ChunkData chunk = chunks.get(i);
            entities.add(CodeChunk.builder()
                    .repositoryId(repositoryId)
                    .filePath(chunk.getFilePath())
                    .chunkText(chunk.getChunkText())
                    .chunkType(chunk.getChunkType())
                    .lineStart(chunk.getLineStart())
                    .lineEnd(chunk.getLineEnd())
                    .language(chunk.getLanguage())
                    .embedding(embeddings.get(i))
                    .build());
        }

        //  delete and insert commit together, readers never see a half-replaced repository
        transactionTemplate.executeWithoutResult(status -> {
            int removed = codeChunkRepository.deleteByRepositoryId(repositoryId);
            if (removed > 0) log.info("Cleared {} old chunk(s) of repository {}", removed, repositoryId);
            codeChunkRepository.saveAll(entities);
        });
    }

    /**
     * stores the aggregates on a fresh copy of the repository, so edits made during the run survive
     *
     * @param repositoryId
     * @param progress
     * @param codeFiles
     * @param chunks
     */
    private void finish(Long repositoryId, ProgressReporter progress, List<Path> codeFiles, List<ChunkData> chunks) {
        //  total lines counts chunk spans, overlapping windows included
        long totalLines = chunks.stream().mapToLong(chunk -> chunk.getLineEnd() - chunk.getLineStart() + 1).sum();

        //  files per language, keys sorted
        Map<String, Integer> languages = new TreeMap<>();
        for (Path file : codeFiles) {
            languages.merge(SourceLanguages.languageOf(file), 1, Integer::sum);
        }

        //  re-read inside the transaction, a concurrent rename stays in place
        transactionTemplate.executeWithoutResult(status -> {
            Repo current = repoRepository.findById(repositoryId)
                    .orElseThrow(() -> new ResourceNotFoundException("Repository " + repositoryId + " was deleted during analysis"));
            current.markReady(codeFiles.size(), totalLines, languages);
            repoRepository.save(current);
            progress.report(PipelineStage.DONE);
        });
    }

    /**
     * records the failure on the repository and on its most recent job.
     * Bookkeeping errors are attached to the original failure instead of replacing it.
     *
     * @param repositoryId
     * @param failure
     */
    private void markFailed(Long repositoryId, RuntimeException failure) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                //  a repository deleted meanwhile has nothing left to mark
                repoRepository.findById(repositoryId).ifPresent(repo -> {
                    repo.markFailed();
                    repoRepository.save(repo);
                });
                //  the newest job is the one this run was reporting on
                jobRepository.findFirstByRepositoryIdOrderByCreatedAtDescIdDesc(repositoryId).ifPresent(job -> {
                    job.fail(String.valueOf(failure.getMessage()));
                    jobRepository.save(job);
                });
            });
        } catch (RuntimeException bookkeeping) {
            log.error("Could not record the failure of repository {}", repositoryId, bookkeeping);
            failure.addSuppressed(bookkeeping);
        }
    }
}
