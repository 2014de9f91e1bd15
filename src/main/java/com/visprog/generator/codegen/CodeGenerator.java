package com.visprog.generator.codegen;

import java.util.List;

import com.visprog.generator.model.BlueprintGraph;
import com.visprog.generator.model.UserFunction;

/**
 * Turns a Blueprint graph into source code of one target language.
 */
public interface CodeGenerator {

    default CodeGenerationResult generate(BlueprintGraph graph) {
        return generate(graph, List.of(), GenerationOptions.defaults());
    }

    default CodeGenerationResult generate(BlueprintGraph graph, GenerationOptions options) {
        return generate(graph, List.of(), options);
    }

    /**
     * Generates the main graph together with the given user functions.
     */
    CodeGenerationResult generate(BlueprintGraph graph, List<UserFunction> functions, GenerationOptions options);

    GenerationCheckResult canGenerate(BlueprintGraph graph);

    List<String> getSupportedNodeTypes();

    /**
     * Target language id, e.g. {@code "cpp"}.
     */
    String getLanguage();
}
