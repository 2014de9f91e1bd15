package com.visprog.generator.codegen.generator.function;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.diagnostics.CodeGenErrorCode;
import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.mapper.PortTypeMapper;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.FunctionParameter;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.UserFunction;

/**
 * Call of a user function.
 *
 * The call result is kept in {@code result_<suffix>}. For functions with
 * several outputs every output is also unpacked into {@code out_<name>_<suffix>},
 * by position in the declared parameter list. A call whose function cannot be
 * resolved falls back to the node's own port order.
 */
public class CallUserFunctionNodeGenerator extends BaseNodeGenerator {

    public CallUserFunctionNodeGenerator() {
        super(StandardNodeType.CALL_USER_FUNCTION);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();

        Optional<String> functionId = node.stringProperty("functionId");
        if (functionId.isEmpty()) {
            helpers.addError(node.getId(), CodeGenErrorCode.MISSING_FUNCTION_REFERENCE,
                    "Не указана вызываемая функция", "Called function is not specified");
            return code(List.of(ind + "// Ошибка: функция не указана"));
        }

        Optional<UserFunction> function = helpers.findFunction(functionId.get());
        String name = function.map(FunctionEntryNodeGenerator::functionName).orElseGet(() -> fallbackName(node));
        String call = name + "(" + String.join(", ", arguments(node, function, helpers)) + ")";

        int outputCount = function.map(f -> f.outputParameters().size()).orElse(node.dataOutputs().size());
        if (outputCount == 0) {
            return code(List.of(ind + call + ";"));
        }

        List<String> lines = new ArrayList<>();
        String suffix = NamingUtil.nodeSuffix(node.getId());
        String resultVar = "result_" + suffix;
        lines.add(ind + "auto " + resultVar + " = " + call + ";");
        helpers.declareVariable(node.getId() + "-result", resultVar, name, "auto", node.getId());

        if (function.isPresent() && function.get().hasMultipleOutputs()) {
            helpers.requireInclude("<tuple>");
            List<FunctionParameter> outputs = function.get().outputParameters();
            for (int i = 0; i < outputs.size(); i++) {
                FunctionParameter output = outputs.get(i);
                String fieldVar = "out_" + FunctionEntryNodeGenerator.parameterName(output, i) + "_" + suffix;
                lines.add(ind + "auto " + fieldVar + " = std::get<" + i + ">(" + resultVar + ");");
                helpers.declareVariable(outputKey(node, output), fieldVar, output.getName(),
                        PortTypeMapper.targetType(output.getDataType()), node.getId());
            }
        }
        return code(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        String resultVar = helpers.getVariable(node.getId() + "-result")
                .map(VariableInfo::getCodeName)
                .orElse("result_" + NamingUtil.nodeSuffix(node.getId()));

        Optional<UserFunction> function = helpers.findFunction(node.stringProperty("functionId").orElse(null));
        if (function.isPresent()) {
            List<FunctionParameter> outputs = function.get().outputParameters();
            if (outputs.size() <= 1) {
                return Optional.of(resultVar);
            }
            int index = outputIndexByPort(outputs, portId);
            if (index < 0) {
                return Optional.of(resultVar);
            }
            return Optional.of(helpers.getVariable(outputKey(node, outputs.get(index)))
                    .map(VariableInfo::getCodeName)
                    .orElse("std::get<" + index + ">(" + resultVar + ")"));
        }

        List<NodePort> outputs = node.dataOutputs();
        if (outputs.size() <= 1) {
            return Optional.of(resultVar);
        }
        for (int i = 0; i < outputs.size(); i++) {
            if (outputs.get(i).getId().equals(portId) || outputs.get(i).matches(portId)) {
                return Optional.of("std::get<" + i + ">(" + resultVar + ")");
            }
        }
        return Optional.of(resultVar);
    }

    /**
     * Position of the output parameter a call-node port stands for, in
     * declared order; -1 when no parameter matches.
     */
    static int outputIndexByPort(List<FunctionParameter> outputs, String portId) {
        for (int i = 0; i < outputs.size(); i++) {
            if (NodePort.idMatches(portId, outputs.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    private static String outputKey(GraphNode node, FunctionParameter output) {
        return node.getId() + "-result-" + output.getId();
    }

    private List<String> arguments(GraphNode node, Optional<UserFunction> function, GeneratorHelpers helpers) {
        List<String> args = new ArrayList<>();
        if (function.isPresent()) {
            for (FunctionParameter input : function.get().inputParameters()) {
                args.add(helpers.getInputExpression(node, input.getId())
                        .orElse(PortTypeMapper.defaultLiteral(input.getDataType())));
            }
        } else {
            for (NodePort port : node.dataInputs()) {
                args.add(helpers.getInputExpression(node, port.localId(node.getId()))
                        .orElse(PortTypeMapper.defaultLiteral(port.getDataType())));
            }
        }
        return args;
    }

    private String fallbackName(GraphNode node) {
        String name = NamingUtil.transliterate(node.stringProperty("functionName").orElse(node.getLabel()));
        return name.isEmpty() ? "func_" + NamingUtil.cleanId(node.stringProperty("functionId").orElse(node.getId()), 8)
                : name;
    }
}
