package com.repo.query.service.repo;

import java.nio.file.Path;
import java.util.List;

public interface GitIngestionService {
    //  shallow clone into a fresh temporary directory; throws PipelineFailureException on failure
    Path cloneRepository(String repoUrl, String branch);

    List<Path> discoverFiles(Path root);

    //  idempotent
    void cleanup(Path directory);
}
