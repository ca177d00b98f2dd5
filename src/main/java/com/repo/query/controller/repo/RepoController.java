package com.repo.query.controller.repo;

import com.repo.query.dto.*;
import com.repo.query.service.repo.RepoService;
import lombok.AllArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(path = "${repo.path}/repositories")
@AllArgsConstructor
public class RepoController {
    private final RepoService repoService;

    /**
     * registers a repository and queues its analysis. Returns before the analysis finishes.
     *
     * @param request
     * @return
     */
    @PostMapping
    public ResponseEntity<RepoResponseDto> create(@RequestBody RepoCreateRequestDto request) {
        return ResponseEntity.accepted().body(repoService.create(request));
    }

    @GetMapping
    public ResponseEntity<PagedResponseDto<RepoResponseDto>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") long offset
    ) {
        return ResponseEntity.ok(repoService.list(status, search, limit, offset));
    }

    @GetMapping("/{repoId}")
    public ResponseEntity<RepoResponseDto> get(@PathVariable Long repoId) {
        return ResponseEntity.ok(repoService.get(repoId));
    }

    /**
     * updates name/branch, or re-analyzes with action "reanalyze"
     *
     * @param repoId
     * @param request
     * @return
     */
    @PutMapping("/{repoId}")
    public ResponseEntity<RepoResponseDto> update(@PathVariable Long repoId, @RequestBody RepoUpdateRequestDto request) {
        return ResponseEntity.accepted().body(repoService.update(repoId, request));
    }

    @DeleteMapping("/{repoId}")
    public ResponseEntity<RepoDeleteResponseDto> delete(@PathVariable Long repoId) {
        return ResponseEntity.ok(repoService.delete(repoId));
    }

    @GetMapping("/{repoId}/statistics")
    public ResponseEntity<RepoStatisticsDto> statistics(@PathVariable Long repoId) {
        return ResponseEntity.ok(repoService.statistics(repoId));
    }
}
