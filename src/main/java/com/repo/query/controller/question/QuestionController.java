package com.repo.query.controller.question;

import com.repo.query.dto.ApiResponse;
import com.repo.query.dto.ChatRequestDto;
import com.repo.query.dto.PagedResponseDto;
import com.repo.query.dto.QuestionResponseDto;
import com.repo.query.service.question.QuestionService;
import lombok.AllArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(path = "${repo.path}")
@AllArgsConstructor
public class QuestionController {
    private final QuestionService questionService;

    /**
     * answers a question from the repository's indexed code.
     * An answer produced without the language model still returns 200 and is flagged degraded.
     *
     * @param repoId
     * @param request
     * @return
     */
    @PostMapping("/repositories/{repoId}/questions")
    public ResponseEntity<QuestionResponseDto> ask(@PathVariable Long repoId, @RequestBody ChatRequestDto request) {
        return ResponseEntity.ok(questionService.ask(repoId, request.getQuestion()));
    }

    @GetMapping("/repositories/{repoId}/questions")
    public ResponseEntity<PagedResponseDto<QuestionResponseDto>> list(
            @PathVariable Long repoId,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") long offset
    ) {
        return ResponseEntity.ok(questionService.list(repoId, limit, offset));
    }

    @GetMapping("/questions/{questionId}")
    public ResponseEntity<QuestionResponseDto> get(@PathVariable Long questionId) {
        return ResponseEntity.ok(questionService.get(questionId));
    }

    @DeleteMapping("/questions/{questionId}")
    public ResponseEntity<ApiResponse> delete(@PathVariable Long questionId) {
        questionService.delete(questionId);
        return ResponseEntity.ok(new ApiResponse("Question deleted successfully", questionId));
    }
}
