package com.visprog.generator.codegen.exception;

/**
 * Generation could not produce a translation unit at all, e.g. because the
 * output template failed to render. Per-node problems are diagnostics, not
 * exceptions.
 */
public class CodeGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
