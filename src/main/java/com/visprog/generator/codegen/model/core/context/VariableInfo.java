package com.visprog.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Symbol table entry: a variable declared in the generated code.
 */
@Value
@Builder
public class VariableInfo {

    /**
     * Name in the generated code.
     */
    @NonNull
    String codeName;

    /**
     * Name as the user wrote it, possibly Cyrillic.
     */
    String originalName;

    @NonNull
    String cppType;

    /**
     * Node that declared the variable.
     */
    String nodeId;
}
