package com.repo.query.model.question;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * a citation of a retrieved chunk, stored as json on the question row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceReference {
    private String file;
    private int lineStart;
    private int lineEnd;
    private double relevance;
    private String snippet;
}
