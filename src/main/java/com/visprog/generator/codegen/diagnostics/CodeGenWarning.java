package com.visprog.generator.codegen.diagnostics;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class CodeGenWarning {

    @Builder.Default
    String nodeId = "";

    @NonNull
    CodeGenWarningCode code;

    /**
     * Russian message.
     */
    String message;

    String messageEn;
}
