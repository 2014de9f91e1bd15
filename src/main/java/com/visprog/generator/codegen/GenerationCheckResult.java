package com.visprog.generator.codegen;

import java.util.List;

import com.visprog.generator.codegen.diagnostics.CodeGenError;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of the pre-generation check of a graph.
 */
@Value
@Builder
public class GenerationCheckResult {
    boolean canGenerate;

    @Singular
    List<CodeGenError> errors;
}
