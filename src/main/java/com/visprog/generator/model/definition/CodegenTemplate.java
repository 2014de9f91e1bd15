package com.visprog.generator.model.definition;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * C++ emission rules a package attaches to a node definition.
 *
 * Placeholders understood in {@code template}, {@code before} and {@code after}:
 * <ul>
 *   <li>{@code {{input.<portId>}}} - upstream expression of the input</li>
 *   <li>{@code {{output.<portId>}}} - variable name for the output</li>
 *   <li>{@code {{prop.<propId>}}} - node property or its declared default</li>
 *   <li>{@code {{node.label}}} / {@code {{node.labelRu}}} - display labels</li>
 * </ul>
 */
@Value
@Builder
public class CodegenTemplate {

    String template;

    /**
     * Headers in include syntax, e.g. {@code <cmath>} or {@code "mylib.h"}.
     */
    @Singular
    List<String> includes;

    String before;

    String after;

    public boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }
}
