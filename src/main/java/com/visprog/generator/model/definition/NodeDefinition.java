package com.visprog.generator.model.definition;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Node type supplied by a package, optionally carrying C++ emission rules.
 */
@Value
@Builder
public class NodeDefinition {

    @NonNull
    String type;

    @NonNull
    String label;

    String labelRu;

    @Builder.Default
    String category = "other";

    String description;

    @Singular
    List<PortDefinition> inputs;

    @Singular
    List<PortDefinition> outputs;

    @Singular
    List<PropertyDefinition> properties;

    CodegenTemplate codegen;

    public Optional<CodegenTemplate> getCodegen() {
        return Optional.ofNullable(codegen);
    }

    public boolean hasTemplate() {
        return codegen != null && codegen.hasTemplate();
    }

    public Optional<PropertyDefinition> findProperty(String propertyId) {
        return properties.stream().filter(p -> p.getId().equals(propertyId)).findFirst();
    }

    /**
     * Russian label, falling back to the primary label.
     */
    public String localizedLabel() {
        return labelRu != null && !labelRu.isBlank() ? labelRu : label;
    }
}
