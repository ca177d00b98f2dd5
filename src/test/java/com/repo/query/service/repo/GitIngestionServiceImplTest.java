package com.repo.query.service.repo;

import com.repo.query.exception.PipelineFailureException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitIngestionServiceImplTest {

    @TempDir
    Path workDir;

    private Path cloneBase;
    private GitIngestionServiceImpl ingestionService;

    @BeforeEach
    void setUp() {
        cloneBase = workDir.resolve("clones");
        ingestionService = new GitIngestionServiceImpl(cloneBase.toString(), Duration.ofSeconds(30), "");
    }

    @Test
    void discoversSupportedFilesAndPrunesIgnoredDirectoriesAtAnyDepth() throws IOException {
        Path root = workDir.resolve("checkout");
        touch(root, "src/app.py");
        touch(root, "src/node_modules/pkg/index.js");
        touch(root, "node_modules/left-pad/index.js");
        touch(root, ".git/hooks/pre-commit.py");
        touch(root, "build/generated/Gen.java");
        touch(root, "env/lib/site.py");
        touch(root, "docs/README.md");
        touch(root, "lib/util.go");

        List<Path> files = ingestionService.discoverFiles(root);

        assertThat(files)
                .extracting(file -> root.toAbsolutePath().normalize().relativize(file).toString().replace('\\', '/'))
                .containsExactly("lib/util.go", "src/app.py");
    }

    @Test
    void clonesTheRequestedBranch() throws Exception {
        Path origin = workDir.resolve("origin");
        PersonIdent author = new PersonIdent("dev", "dev@example.com");
        try (Git git = Git.init().setDirectory(origin.toFile()).setInitialBranch("main").call()) {
            touch(origin, "hello.py");
            git.add().addFilepattern(".").call();
            git.commit().setMessage("init").setAuthor(author).setCommitter(author).setSign(false).call();
        }

        Path clone = ingestionService.cloneRepository(origin.toUri().toString(), "main");

        assertThat(clone).startsWith(cloneBase);
        assertThat(clone.resolve("hello.py")).exists();
        ingestionService.cleanup(clone);
        assertThat(clone).doesNotExist();
    }

    @Test
    void failedCloneRemovesItsDirectoryAndRaises() throws IOException {
        String missing = workDir.resolve("does-not-exist").toUri().toString();

        assertThatThrownBy(() -> ingestionService.cloneRepository(missing, "main"))
                .isInstanceOf(PipelineFailureException.class)
                .hasMessageStartingWith("Failed to clone repository");

        try (Stream<Path> leftovers = Files.list(cloneBase)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void cleanupIsIdempotent() throws IOException {
        Path dir = workDir.resolve("scratch");
        touch(dir, "a/b.py");

        ingestionService.cleanup(dir);

        assertThat(dir).doesNotExist();
        assertThatCode(() -> ingestionService.cleanup(dir)).doesNotThrowAnyException();
        assertThatCode(() -> ingestionService.cleanup(null)).doesNotThrowAnyException();
    }

    private static void touch(Path root, String relativePath) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x = 1\n");
    }
}
