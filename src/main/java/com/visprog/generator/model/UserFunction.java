package com.visprog.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A user-defined function with its own sub-graph.
 *
 * The order of {@link #parameters} is authoritative: it fixes the order of the
 * generated parameter list and the field order of the result tuple,
 * independently of how the ports of call nodes are ordered.
 */
@Value
@Builder(toBuilder = true)
public class UserFunction {

    @NonNull
    String id;

    @NonNull
    String name;

    String nameRu;

    String description;

    @Singular
    List<FunctionParameter> parameters;

    @NonNull
    @Builder.Default
    BlueprintGraph graph = BlueprintGraph.empty("");

    boolean pure;

    public List<FunctionParameter> inputParameters() {
        return parameters.stream().filter(FunctionParameter::isInput).toList();
    }

    public List<FunctionParameter> outputParameters() {
        return parameters.stream().filter(FunctionParameter::isOutput).toList();
    }

    public boolean hasMultipleOutputs() {
        return outputParameters().size() > 1;
    }
}
