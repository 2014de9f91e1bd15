package com.visprog.generator.codegen.render;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Pieces of a generated C++ file, in output order.
 */
@Value
@Builder
public class CppTranslationUnit {

    boolean includeHeaders;

    @NonNull
    @Builder.Default
    String graphName = "";

    /**
     * Generation time for the header, omitted when null.
     */
    String generatedAt;

    /**
     * Headers in include syntax, e.g. {@code <iostream>}.
     */
    @Singular
    List<String> includes;

    /**
     * {@code using ...Result = std::tuple<...>;} lines.
     */
    @Singular
    List<String> resultTypes;

    /**
     * Function signatures without the trailing semicolon.
     */
    @Singular
    List<String> forwardDeclarations;

    @Singular
    List<String> mainLines;

    /**
     * One line list per function definition.
     */
    @Singular
    List<List<String>> functionUnits;

    Map<String, Object> toTemplateModel() {
        Map<String, Object> model = new HashMap<>();
        model.put("includeHeaders", includeHeaders);
        model.put("graphName", graphName);
        if (generatedAt != null) {
            model.put("generatedAt", generatedAt);
        }
        model.put("includes", includes);
        model.put("resultTypes", resultTypes);
        model.put("forwardDeclarations", forwardDeclarations);
        model.put("mainLines", mainLines);
        model.put("functionUnits", functionUnits);
        return model;
    }
}
