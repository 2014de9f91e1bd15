package com.visprog.generator.codegen.generator.variable;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

class VariableNodeGeneratorsTest {

    @Test
    void testVariableDeclaredOnceWithTypeDefault() {
        VariableNodeGenerator generator = new VariableNodeGenerator();
        GraphNode counter = NodeFactory.variable("var-1", "Счётчик", PortDataType.INT32);
        RecordingHelpers helpers = new RecordingHelpers();

        List<String> first = generator.generate(counter, RecordingHelpers.context(), helpers).getLines();
        List<String> second = generator.generate(counter, RecordingHelpers.context(), helpers).getLines();

        assertThat(first).containsExactly("int schyotchik = 0;");
        assertThat(second).isEmpty();
        assertThat(generator.getOutputExpression(counter, "var-1-value", RecordingHelpers.context(), helpers))
                .contains("schyotchik");
    }

    @Test
    void testUntypedVariableGetsDeducibleInitializer() {
        VariableNodeGenerator generator = new VariableNodeGenerator();
        GraphNode any = NodeFactory.variable("var-3", "Total", PortDataType.fromString("matrix4x4"));

        List<String> lines = generator.generate(any, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines).containsExactly("auto total = 0;");
    }

    @Test
    void testStringVariable() {
        VariableNodeGenerator generator = new VariableNodeGenerator();
        GraphNode name = NodeFactory.variable("var-2", "User Name", PortDataType.STRING);

        List<String> lines = generator.generate(name, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines).containsExactly("std::string user_name = \"\";");
    }

    @Test
    void testSetVariableDeclaresOnFirstAssignment() {
        SetVariableNodeGenerator generator = new SetVariableNodeGenerator();
        GraphNode set = NodeFactory.setVariable("set-1", "total", PortDataType.FLOAT);
        RecordingHelpers helpers = new RecordingHelpers().input(set, "value", "(a + b)");

        List<String> first = generator.generate(set, RecordingHelpers.context(), helpers).getLines();
        List<String> second = generator.generate(set, RecordingHelpers.context(), helpers).getLines();

        assertThat(first).containsExactly("float total = (a + b);");
        assertThat(second).containsExactly("total = (a + b);");
    }

    @Test
    void testSetVariableAssignsDeclaredVariable() {
        VariableNodeGenerator declare = new VariableNodeGenerator();
        SetVariableNodeGenerator assign = new SetVariableNodeGenerator();
        GraphNode variable = NodeFactory.variable("var-1", "total", PortDataType.FLOAT);
        GraphNode set = NodeFactory.setVariable("set-1", "total", PortDataType.FLOAT);
        RecordingHelpers helpers = new RecordingHelpers();
        helpers.declareVariable("total", "total", "total", "float", "var-1");

        declare.generate(variable, RecordingHelpers.context(), helpers);
        List<String> lines = assign.generate(set, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly("total = 0;");
    }

    @Test
    void testGetVariableResolvesReferencedDeclaration() {
        GetVariableNodeGenerator generator = new GetVariableNodeGenerator();
        GraphNode get = NodeFactory.getVariable("get-1", "Счёт", PortDataType.INT32).toBuilder()
                .property("variableId", "var-1")
                .build();
        RecordingHelpers helpers = new RecordingHelpers();
        helpers.declareVariable("var-1", "score_total", "Счёт", "int", "var-1");

        assertThat(generator.getOutputExpression(get, "get-1-value", RecordingHelpers.context(), helpers))
                .contains("score_total");
    }

    @Test
    void testGetVariableFallsBackToSanitizedLabel() {
        GetVariableNodeGenerator generator = new GetVariableNodeGenerator();
        GraphNode get = NodeFactory.getVariable("get-1", "My Value", PortDataType.INT32);

        assertThat(generator.getOutputExpression(get, "get-1-value", RecordingHelpers.context(), new RecordingHelpers()))
                .contains("my_value");
    }
}
