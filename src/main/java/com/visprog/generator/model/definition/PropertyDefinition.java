package com.visprog.generator.model.definition;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Editable property declared by a package node definition.
 */
@Value
@Builder
public class PropertyDefinition {

    @NonNull
    String id;

    @Builder.Default
    String name = "";

    String nameRu;

    /**
     * One of string, number, boolean, enum, color, code.
     */
    @Builder.Default
    String type = "string";

    Object defaultValue;
}
