package com.visprog.generator.codegen.generator.math;

import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Pure {@code (a op b)} expression with per-operator defaults for
 * unconnected operands.
 */
public class BinaryOperatorNodeGenerator extends BaseNodeGenerator {

    private final String operator;
    private final String defaultA;
    private final String defaultB;

    public BinaryOperatorNodeGenerator(StandardNodeType type, String operator, String defaultA, String defaultB) {
        super(type);
        this.operator = operator;
        this.defaultA = defaultA;
        this.defaultB = defaultB;
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return noop();
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        String a = helpers.getInputExpression(node, "a").orElse(defaultA);
        String b = helpers.getInputExpression(node, "b").orElse(defaultB);
        checkOperands(node, a, b, helpers);
        return Optional.of("(" + a + " " + operator + " " + b + ")");
    }

    /**
     * Hook for operand diagnostics, called on every resolution.
     */
    protected void checkOperands(GraphNode node, String a, String b, GeneratorHelpers helpers) {
        // no checks for plain operators
    }
}
