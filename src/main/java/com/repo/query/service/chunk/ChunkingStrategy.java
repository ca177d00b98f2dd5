package com.repo.query.service.chunk;

public enum ChunkingStrategy {
    //  declarations from a syntax tree, falling back to GENERIC
    STRUCTURAL,
    //  fixed, non-overlapping line windows
    GENERIC;

    public static final String STRUCTURAL_LANGUAGE = PythonStructureParser.LANGUAGE;

    public static ChunkingStrategy forLanguage(String language) {
        return STRUCTURAL_LANGUAGE.equals(language) ? STRUCTURAL : GENERIC;
    }
}
