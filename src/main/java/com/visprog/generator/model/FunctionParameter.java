package com.visprog.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Declared parameter of a user-defined function.
 */
@Value
@Builder(toBuilder = true)
public class FunctionParameter {

    @NonNull
    String id;

    @NonNull
    String name;

    String nameRu;

    @NonNull
    PortDataType dataType;

    @NonNull
    PortDirection direction;

    Object defaultValue;

    public boolean isInput() {
        return direction == PortDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PortDirection.OUTPUT;
    }
}
