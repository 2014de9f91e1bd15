package com.visprog.generator.codegen.generator;

import com.visprog.generator.codegen.generator.flow.BranchNodeGenerator;
import com.visprog.generator.codegen.generator.flow.DoNNodeGenerator;
import com.visprog.generator.codegen.generator.flow.DoOnceNodeGenerator;
import com.visprog.generator.codegen.generator.flow.DoWhileNodeGenerator;
import com.visprog.generator.codegen.generator.flow.EndNodeGenerator;
import com.visprog.generator.codegen.generator.flow.FlipFlopNodeGenerator;
import com.visprog.generator.codegen.generator.flow.ForEachNodeGenerator;
import com.visprog.generator.codegen.generator.flow.ForLoopNodeGenerator;
import com.visprog.generator.codegen.generator.flow.GateNodeGenerator;
import com.visprog.generator.codegen.generator.flow.LoopControlNodeGenerator;
import com.visprog.generator.codegen.generator.flow.MultiGateNodeGenerator;
import com.visprog.generator.codegen.generator.flow.ParallelNodeGenerator;
import com.visprog.generator.codegen.generator.flow.SequenceNodeGenerator;
import com.visprog.generator.codegen.generator.flow.StartNodeGenerator;
import com.visprog.generator.codegen.generator.flow.SwitchNodeGenerator;
import com.visprog.generator.codegen.generator.flow.WhileLoopNodeGenerator;
import com.visprog.generator.codegen.generator.function.CallUserFunctionNodeGenerator;
import com.visprog.generator.codegen.generator.function.FunctionEntryNodeGenerator;
import com.visprog.generator.codegen.generator.function.FunctionReturnNodeGenerator;
import com.visprog.generator.codegen.generator.io.InputNodeGenerator;
import com.visprog.generator.codegen.generator.io.PrintNodeGenerator;
import com.visprog.generator.codegen.generator.math.BinaryOperatorNodeGenerator;
import com.visprog.generator.codegen.generator.math.DivisionNodeGenerator;
import com.visprog.generator.codegen.generator.math.NotNodeGenerator;
import com.visprog.generator.codegen.generator.other.CommentNodeGenerator;
import com.visprog.generator.codegen.generator.other.FallbackNodeGenerator;
import com.visprog.generator.codegen.generator.other.RerouteNodeGenerator;
import com.visprog.generator.codegen.generator.template.TemplateNodeGenerator;
import com.visprog.generator.codegen.generator.variable.GetVariableNodeGenerator;
import com.visprog.generator.codegen.generator.variable.SetVariableNodeGenerator;
import com.visprog.generator.codegen.generator.variable.VariableNodeGenerator;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.definition.NodeDefinition;
import com.visprog.generator.model.definition.NodeDefinitionProvider;

import lombok.experimental.UtilityClass;

/**
 * Registry construction strategies.
 */
@UtilityClass
public class NodeGeneratorRegistries {

    /**
     * Registry with a generator for every standard node type.
     */
    public static NodeGeneratorRegistry standard() {
        NodeGeneratorRegistry registry = new NodeGeneratorRegistry();

        // Flow
        registry.register(new StartNodeGenerator());
        registry.register(new EndNodeGenerator());
        registry.register(new BranchNodeGenerator());
        registry.register(new ForLoopNodeGenerator());
        registry.register(new WhileLoopNodeGenerator());
        registry.register(new DoWhileNodeGenerator());
        registry.register(new ForEachNodeGenerator());
        registry.register(new SwitchNodeGenerator());
        registry.register(new LoopControlNodeGenerator());
        registry.register(new SequenceNodeGenerator());
        registry.register(new ParallelNodeGenerator());
        registry.register(new GateNodeGenerator());
        registry.register(new DoNNodeGenerator());
        registry.register(new DoOnceNodeGenerator());
        registry.register(new FlipFlopNodeGenerator());
        registry.register(new MultiGateNodeGenerator());

        // Variables
        registry.register(new VariableNodeGenerator());
        registry.register(new GetVariableNodeGenerator());
        registry.register(new SetVariableNodeGenerator());

        // Math, comparison, logic
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.ADD, "+", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.SUBTRACT, "-", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.MULTIPLY, "*", "0", "0"));
        registry.register(DivisionNodeGenerator.divide());
        registry.register(DivisionNodeGenerator.modulo());
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.EQUAL, "==", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.NOT_EQUAL, "!=", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.GREATER, ">", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.LESS, "<", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.GREATER_EQUAL, ">=", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.LESS_EQUAL, "<=", "0", "0"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.AND, "&&", "false", "false"));
        registry.register(new BinaryOperatorNodeGenerator(StandardNodeType.OR, "||", "false", "false"));
        registry.register(new NotNodeGenerator());

        // I/O
        registry.register(new PrintNodeGenerator());
        registry.register(new InputNodeGenerator());

        // User functions
        registry.register(new FunctionEntryNodeGenerator());
        registry.register(new FunctionReturnNodeGenerator());
        registry.register(new CallUserFunctionNodeGenerator());

        // Other
        registry.register(new CommentNodeGenerator());
        registry.register(new RerouteNodeGenerator());
        registry.register(new FallbackNodeGenerator());

        return registry;
    }

    /**
     * Standard registry, then a template generator for each of {@code types}
     * whose definition carries a template. Templates registered later win, so
     * a package can replace a standard node type.
     */
    public static NodeGeneratorRegistry withPackages(NodeDefinitionProvider provider, Iterable<String> types) {
        NodeGeneratorRegistry registry = standard();
        for (String type : types) {
            provider.find(type)
                    .filter(NodeDefinition::hasTemplate)
                    .ifPresent(definition -> registry.register(new TemplateNodeGenerator(definition)));
        }
        return registry;
    }

    /**
     * {@link #withPackages(NodeDefinitionProvider, Iterable)} over every type
     * the provider knows.
     */
    public static NodeGeneratorRegistry withPackages(NodeDefinitionProvider provider) {
        return withPackages(provider, provider.types());
    }
}
