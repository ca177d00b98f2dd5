package com.repo.query.service.question;

import com.repo.query.dto.PagedResponseDto;
import com.repo.query.dto.QuestionResponseDto;

public interface QuestionService {
    QuestionResponseDto ask(Long repositoryId, String question);

    PagedResponseDto<QuestionResponseDto> list(Long repositoryId, int limit, long offset);

    QuestionResponseDto get(Long questionId);

    void delete(Long questionId);
}
