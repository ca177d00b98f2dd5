package com.repo.query.controller.analysis;

import com.repo.query.dto.AnalysisStatusDto;
import com.repo.query.service.repo.RepoService;
import lombok.AllArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(path = "${repo.path}/repositories")
@AllArgsConstructor
public class AnalysisController {
    private final RepoService repoService;

    //  progress of the most recent analysis job
    @GetMapping("/{repoId}/analysis")
    public ResponseEntity<AnalysisStatusDto> status(@PathVariable Long repoId) {
        return ResponseEntity.ok(repoService.analysisStatus(repoId));
    }
}
