package com.repo.query.service.chat;

import com.repo.query.model.question.SourceReference;
import com.repo.query.service.embedding.VectorEmbeddingService;
import com.repo.query.service.retrieval.RetrievedChunk;
import com.repo.query.service.retrieval.VectorRetrievalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * answers questions about a repository: embed the question, retrieve the closest chunks,
 * and let the generation backend answer from them
 */
@Slf4j
@Service
public class ChatService {
    public static final String NO_RELEVANT_CODE =
            "I couldn't find relevant code in this repository to answer your question.";
    public static final String MODEL_NONE = "none";
    static final int SNIPPET_LENGTH = 200;

    private final VectorEmbeddingService embeddingService;
    private final VectorRetrievalService retrievalService;
    private final GenerationClient generationClient;
    private final Resource questionPromptResource;
    private final int topK;

    public ChatService(
            VectorEmbeddingService embeddingService,
            VectorRetrievalService retrievalService,
            GenerationClient generationClient,
            @Value("classpath:prompts/code-question.st") Resource questionPromptResource,
            @Value("${query.retrieval.top-k:5}") int topK
    ) {
        this.embeddingService = embeddingService;
        this.retrievalService = retrievalService;
        this.generationClient = generationClient;
        this.questionPromptResource = questionPromptResource;
        this.topK = topK;
    }

    /**
     * runs the retrieval-augmented answer flow for one question.
     * An unavailable backend gives a degraded result with a null answer; confidence always
     * reflects retrieval quality.
     *
     * @param question
     * @param repositoryId
     * @return
     */
    public AnswerResult answer(String question, Long repositoryId) {
        long start = System.nanoTime();
        log.info("Analyzing question for repository {}: {}", repositoryId, question);

        float[] queryVector = embeddingService.embed(question);
        List<RetrievedChunk> chunks = retrievalService.retrieve(repositoryId, queryVector, topK);

        //  nothing to ground an answer on, so do not spend a generation call
        if (chunks.isEmpty()) {
            return AnswerResult.builder()
                    .answerText(NO_RELEVANT_CODE)
                    .confidence(0.0)
                    .sources(List.of())
                    .modelUsed(MODEL_NONE)
                    .processingTimeMs(elapsedMs(start))
                    .degraded(false)
                    .build();
        }

        String prompt = buildPrompt(question, buildContext(chunks));
        GenerationResult generation = generationClient.generate(prompt);

        String answerText = switch (generation.getStatus()) {
            case GENERATED -> generation.getText();
            case UNREACHABLE, FAILED -> {
                log.warn("Answering without generation for repository {}: {}", repositoryId, generation.getReason());
                yield null;
            }
        };

        return AnswerResult.builder()
                .answerText(answerText)
                .confidence(round(chunks.stream().mapToDouble(RetrievedChunk::getSimilarity).max().orElse(0.0)))
                .sources(toSources(chunks))
                .modelUsed(generationClient.modelName())
                .processingTimeMs(elapsedMs(start))
                .degraded(!generation.isAvailable())
                .build();
    }

    /**
     * one labeled section per chunk, in retrieval order
     *
     * @param chunks
     * @return
     */
    String buildContext(List<RetrievedChunk> chunks) {
        List<String> sections = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            sections.add("--- Source %d: %s (lines %d-%d) ---\n%s\n".formatted(
                    i + 1, chunk.getFilePath(), chunk.getLineStart(), chunk.getLineEnd(), chunk.getChunkText()));
        }
        return String.join("\n", sections);
    }

    String buildPrompt(String question, String context) {
        PromptTemplate promptTemplate = new PromptTemplate(questionPromptResource);
        return promptTemplate.render(Map.of(
                "context", context,
                "question", question
        ));
    }

    private List<SourceReference> toSources(List<RetrievedChunk> chunks) {
        return chunks.stream()
                .map(chunk -> SourceReference.builder()
                        .file(chunk.getFilePath())
                        .lineStart(chunk.getLineStart())
                        .lineEnd(chunk.getLineEnd())
                        .relevance(round(chunk.getSimilarity()))
                        .snippet(snippet(chunk.getChunkText()))
                        .build())
                .toList();
    }

    static String snippet(String text) {
        if (text == null) return "";
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
    }

    static double round(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
