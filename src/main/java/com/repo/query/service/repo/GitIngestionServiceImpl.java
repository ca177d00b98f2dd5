package com.repo.query.service.repo;

import com.repo.query.exception.PipelineFailureException;
import com.repo.query.service.chunk.SourceLanguages;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class GitIngestionServiceImpl implements GitIngestionService {
    //  pruned at every depth, whatever the files inside them are
    public static final Set<String> IGNORED_DIRS = Set.of(
            ".git", "node_modules", "__pycache__", "venv", ".venv",
            "dist", "build", ".next", ".tox", "env", ".eggs"
    );

    private final Path cloneBaseDir;
    private final Duration cloneTimeout;
    private final String accessToken;

    public GitIngestionServiceImpl(
            @Value("${query.clone.dir:${java.io.tmpdir}/query-repos}") String cloneBaseDir,
            @Value("${query.clone.timeout:300s}") Duration cloneTimeout,
            @Value("${query.clone.access-token:}") String accessToken
    ) {
        this.cloneBaseDir = Path.of(cloneBaseDir);
        this.cloneTimeout = cloneTimeout;
        this.accessToken = accessToken;
    }

    /**
     * shallow-clones one branch of the repository (depth 1) into a new unique directory under the clone base.
     * The partial directory is removed when the clone fails.
     *
     * @param repoUrl
     * @param branch
     * @return path of the working tree
     */
    @Override
    public Path cloneRepository(String repoUrl, String branch) {
        Path cloneDir;
        //  one unique directory per run under the shared base
        try {
            Files.createDirectories(cloneBaseDir);
            cloneDir = Files.createTempDirectory(cloneBaseDir, "repo-");
        } catch (IOException err) {
            throw new PipelineFailureException("Failed to prepare clone directory: " + err.getMessage(), err);
        }

        log.info("Cloning {} (branch: {}) -> {}", repoUrl, branch, cloneDir);

        //  single branch, depth 1, bounded by the configured timeout
        CloneCommand command = Git.cloneRepository()
                .setURI(repoUrl)
                .setDirectory(cloneDir.toFile())
                .setBranch(branch)
                .setBranchesToClone(List.of("refs/heads/" + branch))
                .setCloneAllBranches(false)
                .setDepth(1)
                .setTimeout((int) Math.max(1, cloneTimeout.toSeconds()));

        //  private repositories: the username is ignored by most providers as long as the token is valid
        if (StringUtils.hasText(accessToken))
            command.setCredentialsProvider(new UsernamePasswordCredentialsProvider("oauth2", accessToken));

        //  the Git handle is closed right away, only the working tree is needed
        try (Git ignored = command.call()) {
            log.info("Clone complete: {}", cloneDir);
            return cloneDir;
        } catch (GitAPIException | JGitInternalException err) {
            log.error("Git clone failed for {}: {}", repoUrl, err.getMessage());
            //  remove whatever the failed clone left behind
            cleanup(cloneDir);
            throw new PipelineFailureException("Failed to clone repository: " + err.getMessage(), err);
        }
    }

    /**
     * walks the working tree and returns every file with a supported extension, skipping ignored directories
     *
     * @param root
     * @return files in path order
     */
    @Override
    public List<Path> discoverFiles(Path root) {
        List<Path> codeFiles = new ArrayList<>();
        Path normalizedRoot = root.toAbsolutePath().normalize();

        try {
            Files.walkFileTree(normalizedRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    //  the root itself is never pruned, even when its name is on the ignore list
                    if (dir.equals(normalizedRoot)) return FileVisitResult.CONTINUE;
                    return IGNORED_DIRS.contains(dir.getFileName().toString())
                            ? FileVisitResult.SKIP_SUBTREE
                            : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    //  symlinks and special files are skipped
                    if (attrs.isRegularFile() && SourceLanguages.isSupported(file)) codeFiles.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException err) {
                    //  unreadable entries are logged and skipped, the walk goes on
                    log.warn("Cannot access {}: {}", file, err.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException err) {
            throw new PipelineFailureException("Failed to walk the cloned repository: " + err.getMessage(), err);
        }

        //  deterministic order, independent of the file system
        codeFiles.sort(null);
        log.info("Discovered {} code files in {}", codeFiles.size(), root);
        return codeFiles;
    }

    @Override
    public void cleanup(Path directory) {
        //  nothing to do when the clone never got that far
        if (directory == null || !Files.exists(directory)) return;
        try {
            FileSystemUtils.deleteRecursively(directory);
            log.info("Cleaned up: {}", directory);
        } catch (IOException err) {
            //  a leftover temp directory does not fail the run
            log.warn("Failed to clean up {}: {}", directory, err.getMessage());
        }
    }
}
