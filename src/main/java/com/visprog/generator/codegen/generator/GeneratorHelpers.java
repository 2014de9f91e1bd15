package com.visprog.generator.codegen.generator;

import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.diagnostics.CodeGenErrorCode;
import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.UserFunction;

/**
 * Services the traversal driver offers to node generators.
 *
 * Ports are addressed by portId suffix, e.g. {@code "condition"} or {@code "then-1"}.
 */
public interface GeneratorHelpers {

    /**
     * Indentation for the current nesting level.
     */
    String indent();

    /**
     * Expression feeding an input: the connected upstream expression, else the
     * port's user value, else its declared default. Empty when none applies.
     */
    Optional<String> getInputExpression(GraphNode node, String portSuffix);

    /**
     * Expression for an output port of another node.
     */
    String getOutputExpression(GraphNode node, String portId);

    /**
     * Node reached through the execution output matching {@code portSuffix}.
     */
    Optional<GraphNode> getExecutionTarget(GraphNode node, String portSuffix);

    /**
     * Generates the execution chain starting at {@code node} at the current
     * indentation and returns its lines.
     */
    List<String> generateFromNode(GraphNode node);

    void pushIndent();

    void popIndent();

    void addWarning(String nodeId, CodeGenWarningCode code, String message, String messageEn);

    void addError(String nodeId, CodeGenErrorCode code, String message, String messageEn);

    boolean isVariableDeclared(String key);

    void declareVariable(String key, String codeName, String originalName, String cppType, String nodeId);

    Optional<VariableInfo> getVariable(String key);

    /**
     * Adds a header to the include set of the run.
     */
    void requireInclude(String header);

    /**
     * Function whose body is being generated, empty for the main graph.
     */
    Optional<UserFunction> currentFunction();

    /**
     * All functions in scope of the run.
     */
    List<UserFunction> functions();

    default Optional<UserFunction> findFunction(String functionId) {
        if (functionId == null) {
            return Optional.empty();
        }
        return functions().stream().filter(f -> f.getId().equals(functionId)).findFirst();
    }
}
