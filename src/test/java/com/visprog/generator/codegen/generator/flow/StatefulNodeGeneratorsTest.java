package com.visprog.generator.codegen.generator.flow;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

/**
 * Gate, DoN, DoOnce and FlipFlop keep their state in function-local statics.
 */
class StatefulNodeGeneratorsTest {

    @Test
    void testGateStartsOpenAndAppliesControlInputs() {
        GateNodeGenerator generator = new GateNodeGenerator();
        GraphNode gate = NodeFactory.create(StandardNodeType.GATE, "gate-000001");
        GraphNode exit = NodeFactory.create(StandardNodeType.PRINT, "exit");
        RecordingHelpers helpers = new RecordingHelpers()
                .input(gate, "close", "shouldClose")
                .target(gate, "exit", exit);

        List<String> lines = generator.generate(gate, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "static bool gate_open_000001 = true;",
                "if (shouldClose) gate_open_000001 = false;",
                "if (gate_open_000001) {",
                "    // -> exit",
                "}");
    }

    @Test
    void testGateStartClosedProperty() {
        GateNodeGenerator generator = new GateNodeGenerator();
        GraphNode gate = NodeFactory.create(StandardNodeType.GATE, "gate-1").toBuilder()
                .property("startClosed", true)
                .build();

        List<String> lines = generator.generate(gate, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines.get(0)).isEqualTo("static bool gate_open_gate1 = false;");
    }

    @Test
    void testStaticIsDeclaredOncePerRun() {
        GateNodeGenerator generator = new GateNodeGenerator();
        GraphNode gate = NodeFactory.create(StandardNodeType.GATE, "gate-1");
        RecordingHelpers helpers = new RecordingHelpers();

        generator.generate(gate, RecordingHelpers.context(), helpers);
        List<String> second = generator.generate(gate, RecordingHelpers.context(), helpers).getLines();

        assertThat(second).noneMatch(line -> line.startsWith("static"));
    }

    @Test
    void testDoNClampsLimitAndCountsBeforeExit() {
        DoNNodeGenerator generator = new DoNNodeGenerator();
        GraphNode doN = NodeFactory.create(StandardNodeType.DO_N, "don-abcdef");
        GraphNode exit = NodeFactory.create(StandardNodeType.PRINT, "exit");
        RecordingHelpers helpers = new RecordingHelpers()
                .input(doN, "n", "3")
                .target(doN, "exit", exit);

        List<String> lines = generator.generate(doN, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "static int don_counter_abcdef = 0;",
                "if (don_counter_abcdef < std::max(0, static_cast<int>(3))) {",
                "    don_counter_abcdef++;",
                "    // -> exit",
                "}");
        assertThat(helpers.includes()).contains("<algorithm>");
        assertThat(generator.getOutputExpression(doN, "don-abcdef-counter", RecordingHelpers.context(), helpers))
                .contains("don_counter_abcdef");
    }

    @Test
    void testDoNDefaultsLimitToOne() {
        DoNNodeGenerator generator = new DoNNodeGenerator();
        GraphNode doN = NodeFactory.create(StandardNodeType.DO_N, "don-1");

        List<String> lines = generator.generate(doN, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines).contains("if (don_counter_don1 < std::max(0, static_cast<int>(1))) {");
    }

    @Test
    void testDoOnceWithReset() {
        DoOnceNodeGenerator generator = new DoOnceNodeGenerator();
        GraphNode once = NodeFactory.create(StandardNodeType.DO_ONCE, "once-1");
        GraphNode completed = NodeFactory.create(StandardNodeType.PRINT, "completed");
        RecordingHelpers helpers = new RecordingHelpers()
                .input(once, "reset", "again")
                .target(once, "completed", completed);

        List<String> lines = generator.generate(once, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "static bool doonce_done_once1 = false;",
                "if (again) doonce_done_once1 = false;",
                "if (!doonce_done_once1) {",
                "    doonce_done_once1 = true;",
                "    // -> completed",
                "}");
    }

    @Test
    void testFlipFlopTogglesBeforeChoosingArm() {
        FlipFlopNodeGenerator generator = new FlipFlopNodeGenerator();
        GraphNode flip = NodeFactory.create(StandardNodeType.FLIP_FLOP, "flip-1");
        GraphNode a = NodeFactory.create(StandardNodeType.PRINT, "a");
        GraphNode b = NodeFactory.create(StandardNodeType.PRINT, "b");
        RecordingHelpers helpers = new RecordingHelpers()
                .target(flip, "a", a)
                .target(flip, "b", b);

        List<String> lines = generator.generate(flip, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "static bool flipflop_isa_flip1 = false;",
                "flipflop_isa_flip1 = !flipflop_isa_flip1;",
                "if (flipflop_isa_flip1) {",
                "    // -> a",
                "} else {",
                "    // -> b",
                "}");
        assertThat(generator.getOutputExpression(flip, "flip-1-is-a", RecordingHelpers.context(), helpers))
                .contains("flipflop_isa_flip1");
    }

    @Test
    void testFlipFlopWithoutBArmHasNoElse() {
        FlipFlopNodeGenerator generator = new FlipFlopNodeGenerator();
        GraphNode flip = NodeFactory.create(StandardNodeType.FLIP_FLOP, "flip-2");
        GraphNode a = NodeFactory.create(StandardNodeType.PRINT, "a");
        RecordingHelpers helpers = new RecordingHelpers().target(flip, "a", a);

        List<String> lines = generator.generate(flip, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "static bool flipflop_isa_flip2 = false;",
                "flipflop_isa_flip2 = !flipflop_isa_flip2;",
                "if (flipflop_isa_flip2) {",
                "    // -> a",
                "}");
    }

    @Test
    void testFlipFlopIsAResolvesBeforeGeneration() {
        FlipFlopNodeGenerator generator = new FlipFlopNodeGenerator();
        GraphNode flip = NodeFactory.create(StandardNodeType.FLIP_FLOP, "flip-3");
        RecordingHelpers helpers = new RecordingHelpers();

        assertThat(generator.getOutputExpression(flip, "flip-3-is-a", RecordingHelpers.context(), helpers))
                .contains("flipflop_isa_flip3");
        assertThat(generator.getOutputExpression(flip, "flip-3-a", RecordingHelpers.context(), helpers))
                .contains("false");
    }
}
