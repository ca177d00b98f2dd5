package com.repo.query.service.chat;

import com.repo.query.model.question.SourceReference;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnswerResult {
    //  null when generation was unavailable
    String answerText;
    double confidence;
    List<SourceReference> sources;
    String modelUsed;
    long processingTimeMs;
    boolean degraded;
}
