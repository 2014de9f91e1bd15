package com.visprog.generator.codegen.generator.function;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.mapper.PortTypeMapper;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.FunctionParameter;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.UserFunction;

/**
 * Return from a user function. Values are collected in declared output
 * order; unconnected outputs return the default literal of their type.
 */
public class FunctionReturnNodeGenerator extends BaseNodeGenerator {

    public FunctionReturnNodeGenerator() {
        super(StandardNodeType.FUNCTION_RETURN);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();

        Optional<UserFunction> owner = helpers.currentFunction()
                .or(() -> helpers.findFunction(node.stringProperty("functionId").orElse(null)));
        if (owner.isEmpty()) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.ORPHAN_FUNCTION_RETURN,
                    "Узел возврата не принадлежит ни одной функции",
                    "Return node does not belong to any function");
            return code(List.of(ind + "return;"), false);
        }

        UserFunction function = owner.get();
        List<FunctionParameter> outputs = function.outputParameters();
        List<String> values = new ArrayList<>(outputs.size());
        for (FunctionParameter output : outputs) {
            values.add(helpers.getInputExpression(node, output.getId())
                    .orElse(PortTypeMapper.defaultLiteral(output.getDataType())));
        }

        String statement;
        if (values.isEmpty()) {
            statement = "return;";
        } else if (values.size() == 1) {
            statement = "return " + values.get(0) + ";";
        } else {
            statement = "return " + FunctionEntryNodeGenerator.resultTypeName(function)
                    + "{" + String.join(", ", values) + "};";
        }
        return code(List.of(ind + statement), false);
    }
}
