package com.visprog.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int nodesProcessed;

    /**
     * Non-blank lines that are not comments.
     */
    int linesOfCode;

    long generationTimeMillis;
}
