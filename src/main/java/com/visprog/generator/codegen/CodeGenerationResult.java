package com.visprog.generator.codegen;

import java.util.List;

import com.visprog.generator.codegen.diagnostics.CodeGenError;
import com.visprog.generator.codegen.diagnostics.CodeGenWarning;
import com.visprog.generator.codegen.model.core.context.GenerationStats;
import com.visprog.generator.codegen.model.core.context.SourceMapEntry;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one code generation request.
 *
 * Code is produced even when errors were recorded; {@code success} is false
 * in that case.
 */
@Data
@Builder
public class CodeGenerationResult {
    private boolean success;
    private String code;

    @Builder.Default
    private List<String> includes = List.of();

    @Builder.Default
    private List<CodeGenError> errors = List.of();

    @Builder.Default
    private List<CodeGenWarning> warnings = List.of();

    @Builder.Default
    private List<SourceMapEntry> sourceMap = List.of();

    private GenerationStats stats;

    /**
     * Result for a graph rejected before traversal: no code.
     */
    public static CodeGenerationResult failure(List<CodeGenError> errors, GenerationStats stats) {
        return CodeGenerationResult.builder()
                .success(false)
                .code("")
                .errors(List.copyOf(errors))
                .stats(stats)
                .build();
    }

    /**
     * Source lines of the generated code.
     */
    public List<String> lines() {
        return code == null || code.isEmpty() ? List.of() : List.of(code.split("\n", -1));
    }
}
