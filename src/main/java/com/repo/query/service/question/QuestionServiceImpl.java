package com.repo.query.service.question;

import com.repo.query.dto.PagedResponseDto;
import com.repo.query.dto.QuestionResponseDto;
import com.repo.query.exception.RepoNotReadyException;
import com.repo.query.exception.ResourceNotFoundException;
import com.repo.query.model.OffsetPageRequest;
import com.repo.query.model.question.Question;
import com.repo.query.model.question.QuestionRepository;
import com.repo.query.model.repo.Repo;
import com.repo.query.model.repo.RepoRepository;
import com.repo.query.model.repo.RepoStatus;
import com.repo.query.service.chat.AnswerResult;
import com.repo.query.service.chat.ChatService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionServiceImpl implements QuestionService {
    public static final String GENERATION_FAILED = "LLM generation failed.";
    static final int MAX_PAGE_SIZE = 100;

    private final RepoRepository repoRepository;
    private final QuestionRepository questionRepository;
    private final ChatService chatService;

    /**
     * answers a question about a ready repository and records the attempt, degraded or not
     *
     * @param repositoryId
     * @param question
     * @return
     */
    @Override
    public QuestionResponseDto ask(Long repositoryId, String question) {
        if (question == null || question.isBlank()) throw new IllegalArgumentException("Question is required");

        Repo repo = repoRepository.findById(repositoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Repository " + repositoryId + " not found"));
        if (repo.getStatus() != RepoStatus.READY) throw new RepoNotReadyException(repositoryId, repo.getStatus());

        long started = System.currentTimeMillis();
        AnswerResult result;
        try {
            result = chatService.answer(question, repositoryId);
        } catch (RuntimeException err) {
            //  the failed attempt is still recorded before the error reaches the caller
            log.error("Answering question for repository {} failed", repositoryId, err);
            questionRepository.save(Question.builder()
                    .repositoryId(repositoryId)
                    .questionText(question)
                    .answerText(GENERATION_FAILED)
                    .processingTimeMs(System.currentTimeMillis() - started)
                    .degraded(true)
                    .build());
            throw err;
        }

        Question saved = questionRepository.save(Question.builder()
                .repositoryId(repositoryId)
                .questionText(question)
                .answerText(result.getAnswerText() == null ? GENERATION_FAILED : result.getAnswerText())
                .confidenceScore(result.getConfidence())
                .sources(new ArrayList<>(result.getSources()))
                .modelUsed(result.getModelUsed())
                .processingTimeMs(result.getProcessingTimeMs())
                .degraded(result.isDegraded())
                .build());

        if (saved.isDegraded()) log.warn("Question {} answered without generation", saved.getId());
        return toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public PagedResponseDto<QuestionResponseDto> list(Long repositoryId, int limit, long offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE)
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE);
        if (!repoRepository.existsById(repositoryId))
            throw new ResourceNotFoundException("Repository " + repositoryId + " not found");

        Page<Question> page = questionRepository.findByRepositoryIdOrderByCreatedAtDescIdDesc(
                repositoryId, new OffsetPageRequest(offset, limit));

        return PagedResponseDto.<QuestionResponseDto>builder()
                .total(page.getTotalElements())
                .limit(limit)
                .offset(offset)
                .items(page.getContent().stream().map(QuestionServiceImpl::toDto).toList())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionResponseDto get(Long questionId) {
        return toDto(findQuestion(questionId));
    }

    @Override
    @Transactional
    public void delete(Long questionId) {
        questionRepository.delete(findQuestion(questionId));
        log.info("Deleted question {}", questionId);
    }

    private Question findQuestion(Long questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
    }

    static QuestionResponseDto toDto(Question question) {
        return QuestionResponseDto.builder()
                .questionId(question.getId())
                .repositoryId(question.getRepositoryId())
                .question(question.getQuestionText())
                .answer(question.getAnswerText())
                .confidenceScore(question.getConfidenceScore())
                .sources(question.getSources())
                .modelUsed(question.getModelUsed())
                .processingTimeMs(question.getProcessingTimeMs())
                .degraded(question.isDegraded())
                .createdAt(question.getCreatedAt())
                .build();
    }
}
