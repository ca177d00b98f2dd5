package com.repo.query.exception;

import com.repo.query.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalException {
    @ExceptionHandler
    public ResponseEntity<ApiResponse> handleNotFound(ResourceNotFoundException err) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiResponse("GE: Not found", err.getMessage()));
    }

    @ExceptionHandler
    public ResponseEntity<ApiResponse> handleConflict(ConflictException err) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiResponse("GE: Conflict", err.getMessage()));
    }

    //  two concurrent registrations of the same url, caught by the unique constraint
    @ExceptionHandler
    public ResponseEntity<ApiResponse> handleDuplicate(DataIntegrityViolationException err) {
        log.warn("Integrity violation: {}", err.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiResponse("GE: Conflict", "Resource already exists"));
    }

    @ExceptionHandler
    public ResponseEntity<ApiResponse> handleNotReady(RepoNotReadyException err) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponse(
                        "GE: Repository not ready for questions",
                        Map.of(
                                "status", err.getStatus().name().toLowerCase(),
                                "message", "Please wait for analysis to complete"
                        )
                ));
    }

    @ExceptionHandler
    public ResponseEntity<ApiResponse> handleBadRequest(IllegalArgumentException err) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponse("GE: Invalid request", err.getMessage()));
    }

    @ExceptionHandler
    public ResponseEntity<ApiResponse> handlePipelineFailure(PipelineFailureException err) {
        log.error("Analysis run failed while serving a request", err);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponse("GE: Analysis failed", err.getMessage()));
    }
}
