package com.visprog.generator.codegen.generator.function;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.mapper.PortTypeMapper;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.FunctionParameter;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.UserFunction;

/**
 * Entry node of a user function. Emits nothing: the body is generated as a
 * separate unit by the driver. Also owns the naming and signature rules of
 * user functions, shared with return and call nodes.
 *
 * Parameter order is always the declared order of
 * {@link UserFunction#getParameters()}, never the port order of a node.
 */
public class FunctionEntryNodeGenerator extends BaseNodeGenerator {

    public FunctionEntryNodeGenerator() {
        super(StandardNodeType.FUNCTION_ENTRY);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return noop();
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        Optional<UserFunction> function = helpers.currentFunction()
                .or(() -> helpers.findFunction(node.stringProperty("functionId").orElse(null)));
        if (function.isEmpty()) {
            return Optional.of(node.findOutput(localPortId(node, portId))
                    .map(p -> NamingUtil.transliterate(p.getName()))
                    .filter(name -> !name.isEmpty())
                    .orElse("0"));
        }

        List<FunctionParameter> inputs = function.get().inputParameters();
        for (int i = 0; i < inputs.size(); i++) {
            if (NodePort.idMatches(portId, inputs.get(i).getId())) {
                return Optional.of(parameterName(inputs.get(i), i));
            }
        }
        return Optional.of("0");
    }

    /**
     * C++ name of the function: its transliterated name, or a name derived
     * from the id when nothing identifier-safe is left.
     */
    public static String functionName(UserFunction function) {
        String name = NamingUtil.transliterate(function.getName());
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            return "func_" + NamingUtil.cleanId(function.getId(), 8);
        }
        return name;
    }

    public static String parameterName(FunctionParameter parameter, int position) {
        String name = NamingUtil.transliterate(parameter.getName());
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            return "param" + position;
        }
        return name;
    }

    /**
     * {@code void} without outputs, the output's type for one output, the
     * synthesized result type for more.
     */
    public static String returnType(UserFunction function) {
        List<FunctionParameter> outputs = function.outputParameters();
        if (outputs.isEmpty()) {
            return "void";
        }
        if (outputs.size() == 1) {
            return PortTypeMapper.targetType(outputs.get(0).getDataType());
        }
        return resultTypeName(function);
    }

    public static String resultTypeName(UserFunction function) {
        return functionName(function) + "Result";
    }

    /**
     * {@code using <Name>Result = std::tuple<...>;} for functions with two or
     * more outputs, fields in declared output order.
     */
    public static Optional<String> resultTypeDeclaration(UserFunction function) {
        if (!function.hasMultipleOutputs()) {
            return Optional.empty();
        }
        String fields = function.outputParameters().stream()
                .map(p -> PortTypeMapper.targetType(p.getDataType()))
                .collect(Collectors.joining(", "));
        return Optional.of("using " + resultTypeName(function) + " = std::tuple<" + fields + ">;");
    }

    /**
     * Full signature without trailing semicolon, e.g.
     * {@code getMinMaxResult getMinMax(int count)}.
     */
    public static String signature(UserFunction function) {
        List<FunctionParameter> inputs = function.inputParameters();
        StringBuilder params = new StringBuilder();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) {
                params.append(", ");
            }
            FunctionParameter param = inputs.get(i);
            params.append(PortTypeMapper.targetType(param.getDataType()))
                    .append(' ')
                    .append(parameterName(param, i));
        }
        return returnType(function) + " " + functionName(function) + "(" + params + ")";
    }

    private static String localPortId(GraphNode node, String portId) {
        String prefix = node.getId() + "-";
        return portId.startsWith(prefix) ? portId.substring(prefix.length()) : portId;
    }
}
