package com.visprog.generator.model.factory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.visprog.generator.model.EdgeKind;
import com.visprog.generator.model.GraphEdge;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.StandardNodeType;

import static org.assertj.core.api.Assertions.*;

class NodeFactoryTest {

    @ParameterizedTest
    @EnumSource(StandardNodeType.class)
    void testPortIdsAreNodeScoped(StandardNodeType type) {
        GraphNode node = NodeFactory.create(type, "n-7");

        assertThat(node.getType()).isEqualTo(type.getTag());
        assertThat(node.getInputs()).allMatch(p -> p.getId().startsWith("n-7-"));
        assertThat(node.getOutputs()).allMatch(p -> p.getId().startsWith("n-7-"));
    }

    @Test
    void testBranchCountSizesDynamicPorts() {
        GraphNode sequence = NodeFactory.create(StandardNodeType.SEQUENCE, "seq", 4);

        assertThat(sequence.getOutputs())
                .extracting(p -> p.localId("seq"))
                .containsExactly("then-0", "then-1", "then-2", "then-3");
    }

    @Test
    void testDivisorDefaultsToOne() {
        GraphNode divide = NodeFactory.create(StandardNodeType.DIVIDE, "div");

        assertThat(divide.findInput("b")).map(NodePort::getDefaultValue).contains(1);
    }

    @Test
    void testEdgeCarriesSourcePortKind() {
        GraphNode start = NodeFactory.create(StandardNodeType.START, "start");
        GraphNode print = NodeFactory.create(StandardNodeType.PRINT, "print");
        GraphNode input = NodeFactory.create(StandardNodeType.INPUT, "input");

        GraphEdge exec = NodeFactory.exec(start, "exec-out", print);
        GraphEdge data = NodeFactory.edge(input, "value", print, "string");

        assertThat(exec.getKind()).isEqualTo(EdgeKind.EXECUTION);
        assertThat(exec.getTargetPort()).isEqualTo("print-exec-in");
        assertThat(data.getKind()).isEqualTo(EdgeKind.DATA);
        assertThat(data.getDataType()).isEqualTo(PortDataType.STRING);
    }

    @Test
    void testEdgeToMissingPortFails() {
        GraphNode start = NodeFactory.create(StandardNodeType.START, "start");
        GraphNode end = NodeFactory.create(StandardNodeType.END, "end");

        assertThatThrownBy(() -> NodeFactory.edge(start, "value", end, "exec-in"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("start");
    }
}
