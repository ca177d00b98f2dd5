package com.repo.query.exception;

import com.repo.query.model.repo.RepoStatus;
import lombok.Getter;

@Getter
public class RepoNotReadyException extends RuntimeException {
    private final RepoStatus status;

    public RepoNotReadyException(Long repoId, RepoStatus status) {
        super("Repository " + repoId + " is not ready for questions (status: " + status.name().toLowerCase() + ")");
        this.status = status;
    }
}
