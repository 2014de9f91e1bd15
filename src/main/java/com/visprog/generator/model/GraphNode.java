package com.visprog.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A node of a Blueprint graph.
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    @NonNull
    String id;

    /**
     * Type tag, e.g. "Branch" or a package-defined type.
     */
    @NonNull
    String type;

    /**
     * Display label, possibly non-Latin.
     */
    @Builder.Default
    String label = "";

    String customLabel;

    String comment;

    @Singular
    Map<String, Object> properties;

    @Singular
    List<NodePort> inputs;

    @Singular
    List<NodePort> outputs;

    public Optional<NodePort> findInput(String suffix) {
        return inputs.stream().filter(p -> p.matches(suffix)).findFirst();
    }

    public Optional<NodePort> findOutput(String suffix) {
        return outputs.stream().filter(p -> p.matches(suffix)).findFirst();
    }

    public boolean hasExecutionPorts() {
        return inputs.stream().anyMatch(NodePort::isExecution)
                || outputs.stream().anyMatch(NodePort::isExecution);
    }

    public boolean hasExecutionOutput() {
        return outputs.stream().anyMatch(NodePort::isExecution);
    }

    /**
     * Data (non-execution) outputs in positional order.
     */
    public List<NodePort> dataOutputs() {
        return outputs.stream()
                .filter(p -> !p.isExecution())
                .sorted((a, b) -> Integer.compare(a.getIndex(), b.getIndex()))
                .toList();
    }

    /**
     * Data (non-execution) inputs in positional order.
     */
    public List<NodePort> dataInputs() {
        return inputs.stream()
                .filter(p -> !p.isExecution())
                .sorted((a, b) -> Integer.compare(a.getIndex(), b.getIndex()))
                .toList();
    }

    public Optional<Object> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public Optional<String> stringProperty(String key) {
        return property(key).map(String::valueOf).filter(s -> !s.isBlank());
    }

    public boolean booleanProperty(String key, boolean defaultValue) {
        return property(key)
                .map(v -> v instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(v)))
                .orElse(defaultValue);
    }

    public int intProperty(String key, int defaultValue) {
        Object value = properties.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Label shown to the user: the custom label when set, else the label.
     */
    public String displayLabel() {
        return customLabel != null && !customLabel.isBlank() ? customLabel : label;
    }

    /**
     * Returns a copy with the user value of the matching input set.
     */
    public GraphNode withInputValue(String suffix, Object value) {
        List<NodePort> updated = new ArrayList<>(inputs.size());
        for (NodePort port : inputs) {
            updated.add(port.matches(suffix) ? port.toBuilder().value(value).build() : port);
        }
        return toBuilder().clearInputs().inputs(updated).build();
    }
}
