package com.visprog.generator.codegen.generator.flow;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

class MultiGateNodeGeneratorTest {

    private final MultiGateNodeGenerator generator = new MultiGateNodeGenerator();

    @Test
    void testRoundRobinWrapsAround() {
        GraphNode gate = NodeFactory.create(StandardNodeType.MULTI_GATE, "mg-1", 2);
        RecordingHelpers helpers = new RecordingHelpers()
                .target(gate, "out-0", NodeFactory.create(StandardNodeType.PRINT, "p0"))
                .target(gate, "out-1", NodeFactory.create(StandardNodeType.PRINT, "p1"));

        List<String> lines = generator.generate(gate, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "static int multigate_index_mg1 = 0;",
                "const int multigate_selected_mg1 = multigate_index_mg1;",
                "multigate_index_mg1 = (multigate_index_mg1 + 1) % 2;",
                "switch (multigate_selected_mg1) {",
                "case 0:",
                "    // -> p0",
                "    break;",
                "case 1:",
                "    // -> p1",
                "    break;",
                "}");
        assertThat(helpers.warnings()).isEmpty();
    }

    @Test
    void testNoLoopStopsAtLastBranch() {
        GraphNode gate = NodeFactory.create(StandardNodeType.MULTI_GATE, "mg-1", 3).toBuilder()
                .property("loop", false)
                .build();
        RecordingHelpers helpers = new RecordingHelpers()
                .target(gate, "out-0", NodeFactory.create(StandardNodeType.PRINT, "p0"))
                .target(gate, "out-2", NodeFactory.create(StandardNodeType.PRINT, "p2"));

        List<String> lines = generator.generate(gate, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).contains("if (multigate_index_mg1 < 1) multigate_index_mg1++;");
        assertThat(helpers.warnings()).extracting(w -> w.getCode())
                .containsExactly(CodeGenWarningCode.UNCONNECTED_BRANCHES);
    }

    @Test
    void testNoConnectedOutputs() {
        GraphNode gate = NodeFactory.create(StandardNodeType.MULTI_GATE, "mg-1", 2);
        RecordingHelpers helpers = new RecordingHelpers();

        List<String> lines = generator.generate(gate, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly("// MultiGate: нет подключённых выходов");
        assertThat(helpers.warnings()).extracting(w -> w.getCode())
                .containsExactly(CodeGenWarningCode.NO_CONNECTED_OUTPUTS);
    }

    @Test
    void testRandomModeSeedsFromNodeIdByDefault() {
        GraphNode gate = NodeFactory.create(StandardNodeType.MULTI_GATE, "mg-1", 2).toBuilder()
                .property("isRandom", true)
                .build();
        RecordingHelpers helpers = new RecordingHelpers()
                .target(gate, "out-0", NodeFactory.create(StandardNodeType.PRINT, "p0"))
                .target(gate, "out-1", NodeFactory.create(StandardNodeType.PRINT, "p1"));

        List<String> lines = generator.generate(gate, RecordingHelpers.context(), helpers).getLines();

        String seed = Integer.toUnsignedString(MultiGateNodeGenerator.fnv1a("mg-1"));
        assertThat(lines).contains(
                "static std::mt19937 multigate_rng_mg1(" + seed + "u);",
                "std::uniform_int_distribution<int> multigate_dist_mg1(0, 1);",
                "const int multigate_selected_mg1 = multigate_dist_mg1(multigate_rng_mg1);");
        assertThat(helpers.includes()).contains("<random>");
    }

    @Test
    void testExplicitSeedOverridesNodeId() {
        GraphNode gate = NodeFactory.create(StandardNodeType.MULTI_GATE, "mg-1", 2).toBuilder()
                .property("isRandom", true)
                .property("seed", 42)
                .build();

        assertThat(MultiGateNodeGenerator.seedFor(gate)).isEqualTo("42");
    }

    @Test
    void testFnv1aKnownValues() {
        assertThat(Integer.toUnsignedString(MultiGateNodeGenerator.fnv1a(""))).isEqualTo("2166136261");
        assertThat(Integer.toHexString(MultiGateNodeGenerator.fnv1a("a"))).isEqualTo("e40c292c");
    }
}
