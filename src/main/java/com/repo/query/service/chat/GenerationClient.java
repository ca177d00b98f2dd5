package com.repo.query.service.chat;

/**
 * text-generation backend used to phrase answers
 */
public interface GenerationClient {
    //  never throws for backend trouble, see GenerationResult
    GenerationResult generate(String prompt);

    String modelName();
}
