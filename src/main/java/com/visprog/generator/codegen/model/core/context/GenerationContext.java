package com.visprog.generator.codegen.model.core.context;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.visprog.generator.codegen.GenerationOptions;
import com.visprog.generator.codegen.util.IncludeManager;
import com.visprog.generator.model.BlueprintGraph;
import com.visprog.generator.model.UserFunction;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Mutable state of one generation run: indentation, symbol table, visited
 * nodes, diagnostics and collected includes.
 *
 * A context belongs to exactly one run and is discarded afterwards; each
 * function body gets its own.
 */
@Getter
@Builder
public final class GenerationContext {

    @NonNull
    private final BlueprintGraph graph;

    @NonNull
    @Builder.Default
    private final GenerationOptions options = GenerationOptions.defaults();

    /**
     * Function whose body is being generated, null for the main graph.
     */
    private final UserFunction currentFunction;

    @NonNull
    @Builder.Default
    private final List<UserFunction> functions = List.of();

    @Builder.Default
    private final CodeGenDiagnostics diagnostics = new CodeGenDiagnostics();

    @Builder.Default
    private final IncludeManager includes = new IncludeManager();

    @Builder.Default
    private final Map<String, VariableInfo> declaredVariables = new LinkedHashMap<>();

    @Builder.Default
    private final Set<String> processedNodes = new LinkedHashSet<>();

    @Builder.Default
    private final Set<String> resolvingOutputs = new HashSet<>();

    private int indentLevel;

    private int nestingDepth;

    public Optional<UserFunction> getCurrentFunction() {
        return Optional.ofNullable(currentFunction);
    }

    public String indent() {
        return " ".repeat(indentLevel * options.getIndentSize());
    }

    public void pushIndent() {
        indentLevel++;
    }

    public void popIndent() {
        if (indentLevel == 0) {
            throw new IllegalStateException("Indentation popped below zero");
        }
        indentLevel--;
    }

    /**
     * Sets the indentation level the traversal starts at.
     */
    public void startIndentAt(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("Negative indentation level: " + level);
        }
        indentLevel = level;
    }

    public void enterNestedBlock() {
        nestingDepth++;
    }

    public void exitNestedBlock() {
        if (nestingDepth == 0) {
            throw new IllegalStateException("Nested block exited more often than entered");
        }
        nestingDepth--;
    }

    /**
     * Marks a node as emitted. Returns false if it already was.
     */
    public boolean markProcessed(String nodeId) {
        return processedNodes.add(nodeId);
    }

    public boolean isProcessed(String nodeId) {
        return processedNodes.contains(nodeId);
    }

    public boolean isVariableDeclared(String key) {
        return declaredVariables.containsKey(key);
    }

    public void declareVariable(String key, VariableInfo info) {
        declaredVariables.put(key, info);
    }

    public Optional<VariableInfo> getVariable(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(declaredVariables.get(key));
    }

    /**
     * Registers an output being resolved. Returns false if the same output is
     * already being resolved further up the call chain.
     */
    public boolean beginResolving(String outputKey) {
        return resolvingOutputs.add(outputKey);
    }

    public void endResolving(String outputKey) {
        resolvingOutputs.remove(outputKey);
    }
}
