package com.visprog.generator.model.definition;

import com.visprog.generator.model.PortDataType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Port declared by a package node definition.
 */
@Value
@Builder
public class PortDefinition {

    @NonNull
    String id;

    @Builder.Default
    String name = "";

    String nameRu;

    @NonNull
    PortDataType dataType;

    Object defaultValue;
}
