package com.visprog.generator.codegen.generator.template;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.PortDirection;
import com.visprog.generator.model.definition.CodegenTemplate;
import com.visprog.generator.model.definition.NodeDefinition;
import com.visprog.generator.model.definition.PropertyDefinition;

import static org.assertj.core.api.Assertions.*;

class TemplateNodeGeneratorTest {

    private static NodePort port(String id, PortDataType type, PortDirection direction, int index) {
        return NodePort.builder().id(id).dataType(type).direction(direction).index(index).build();
    }

    private static NodeDefinition sqrtDefinition() {
        return NodeDefinition.builder()
                .type("math.sqrt")
                .label("Square Root")
                .labelRu("Квадратный корень")
                .property(PropertyDefinition.builder().id("precision").defaultValue(2).build())
                .codegen(CodegenTemplate.builder()
                        .template("double {{output.result}} = std::sqrt({{input.value}}); // {{prop.precision}}")
                        .before("// {{node.labelRu}}")
                        .include("<cmath>")
                        .build())
                .build();
    }

    private static GraphNode sqrtNode() {
        return GraphNode.builder()
                .id("node-sqrt-01")
                .type("math.sqrt")
                .input(port("node-sqrt-01-exec-in", PortDataType.EXECUTION, PortDirection.INPUT, 0))
                .input(port("node-sqrt-01-value", PortDataType.DOUBLE, PortDirection.INPUT, 1))
                .output(port("node-sqrt-01-exec-out", PortDataType.EXECUTION, PortDirection.OUTPUT, 0))
                .output(port("node-sqrt-01-result", PortDataType.DOUBLE, PortDirection.OUTPUT, 1))
                .build();
    }

    @Test
    void testPlaceholdersAreSubstituted() {
        TemplateNodeGenerator generator = new TemplateNodeGenerator(sqrtDefinition());
        GraphNode node = sqrtNode();
        RecordingHelpers helpers = new RecordingHelpers().atIndent(1).input(node, "value", "x");

        NodeGenerationResult result = generator.generate(node, RecordingHelpers.context(), helpers);

        assertThat(result.getLines()).containsExactly(
                "    // Квадратный корень",
                "    double result__sqrt_01 = std::sqrt(x); // 2");
        assertThat(result.isFollowExecutionFlow()).isTrue();
        assertThat(helpers.includes()).containsExactly("<cmath>");
        assertThat(generator.getOutputExpression(node, "node-sqrt-01-result", RecordingHelpers.context(), helpers))
                .contains("result__sqrt_01");
    }

    @Test
    void testMissingInputAndPropertyAreVisible() {
        NodeDefinition definition = NodeDefinition.builder()
                .type("debug.dump")
                .label("Dump")
                .codegen(CodegenTemplate.builder().template("dump({{input.value}}, {{prop.mode}});").build())
                .build();
        GraphNode node = GraphNode.builder().id("d1").type("debug.dump").build();

        List<String> lines = new TemplateNodeGenerator(definition)
                .generate(node, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines).containsExactly("dump(/* missing input: value */, /* missing prop: mode */);");
    }

    @Test
    void testNodePropertyOverridesDefinitionDefault() {
        GraphNode node = sqrtNode().toBuilder().property("precision", 6).build();
        RecordingHelpers helpers = new RecordingHelpers().input(node, "value", "y");

        List<String> lines = new TemplateNodeGenerator(sqrtDefinition())
                .generate(node, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines.get(lines.size() - 1)).endsWith("// 6");
    }

    @Test
    void testDefinitionWithoutTemplateIsNoop() {
        NodeDefinition definition = NodeDefinition.builder().type("ui.only").label("UI only").build();
        GraphNode node = GraphNode.builder().id("u1").type("ui.only").build();
        RecordingHelpers helpers = new RecordingHelpers();

        NodeGenerationResult result = new TemplateNodeGenerator(definition)
                .generate(node, RecordingHelpers.context(), helpers);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.isFollowExecutionFlow()).isTrue();
        assertThat(helpers.warnings()).isEmpty();
        assertThat(helpers.errors()).isEmpty();
    }

    @Test
    void testPureTemplateNodeActsAsExpression() {
        NodeDefinition definition = NodeDefinition.builder()
                .type("math.abs")
                .label("Abs")
                .codegen(CodegenTemplate.builder().template("std::abs({{input.value}});").include("<cmath>").build())
                .build();
        GraphNode node = GraphNode.builder()
                .id("abs1")
                .type("math.abs")
                .input(port("abs1-value", PortDataType.FLOAT, PortDirection.INPUT, 0))
                .output(port("abs1-result", PortDataType.FLOAT, PortDirection.OUTPUT, 0))
                .build();
        RecordingHelpers helpers = new RecordingHelpers().input(node, "value", "delta");

        assertThat(new TemplateNodeGenerator(definition)
                .getOutputExpression(node, "abs1-result", RecordingHelpers.context(), helpers))
                .contains("std::abs(delta)");
    }
}
