package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A passage reference returned with an answer.
 * Captured when the answer is generated, so later changes to the passage do not affect cached answers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceInfo {

    private String text;
    private double score;
    private String docTitle;
}
