package com.visprog.generator.codegen.generator.variable;

import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Pure read of a variable. Resolves the declaring node given by the
 * {@code variableId} property, then this node's id, then its label, and
 * finally falls back to the sanitized label.
 */
public class GetVariableNodeGenerator extends BaseNodeGenerator {

    public GetVariableNodeGenerator() {
        super(StandardNodeType.GET_VARIABLE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return noop();
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        return Optional.of(node.stringProperty("variableId").flatMap(helpers::getVariable)
                .or(() -> helpers.getVariable(node.getId()))
                .or(() -> helpers.getVariable(node.getLabel()))
                .map(VariableInfo::getCodeName)
                .orElse(NamingUtil.toValidIdentifier(node.getLabel())));
    }
}
