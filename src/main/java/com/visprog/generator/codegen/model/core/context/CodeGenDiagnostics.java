package com.visprog.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import com.visprog.generator.codegen.diagnostics.CodeGenError;
import com.visprog.generator.codegen.diagnostics.CodeGenErrorCode;
import com.visprog.generator.codegen.diagnostics.CodeGenWarning;
import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;

import lombok.Getter;

/**
 * Errors and warnings accumulated during a generation run.
 *
 * Identical entries are recorded once, so resolving the same expression
 * several times does not multiply its warnings.
 */
@Getter
public class CodeGenDiagnostics {
    private final List<CodeGenError> errors = new ArrayList<>();
    private final List<CodeGenWarning> warnings = new ArrayList<>();

    public void addError(String nodeId, CodeGenErrorCode code, String message, String messageEn) {
        addError(CodeGenError.builder()
                .nodeId(nodeId == null ? "" : nodeId)
                .code(code)
                .message(message)
                .messageEn(messageEn)
                .build());
    }

    public void addError(CodeGenError error) {
        if (!errors.contains(error)) {
            errors.add(error);
        }
    }

    public void addWarning(String nodeId, CodeGenWarningCode code, String message, String messageEn) {
        addWarning(CodeGenWarning.builder()
                .nodeId(nodeId == null ? "" : nodeId)
                .code(code)
                .message(message)
                .messageEn(messageEn)
                .build());
    }

    public void addWarning(CodeGenWarning warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public void merge(CodeGenDiagnostics other) {
        other.getErrors().forEach(this::addError);
        other.getWarnings().forEach(this::addWarning);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
