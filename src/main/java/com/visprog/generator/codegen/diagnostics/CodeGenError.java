package com.visprog.generator.codegen.diagnostics;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class CodeGenError {

    /**
     * Offending node, empty for graph-level errors.
     */
    @Builder.Default
    String nodeId = "";

    @NonNull
    CodeGenErrorCode code;

    /**
     * Russian message.
     */
    String message;

    String messageEn;
}
