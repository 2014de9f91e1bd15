package com.visprog.generator.codegen.generator.flow;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

class BranchNodeGeneratorTest {

    private final BranchNodeGenerator generator = new BranchNodeGenerator();

    @Test
    void testBothArmsConnected() {
        GraphNode branch = NodeFactory.create(StandardNodeType.BRANCH, "branch-1");
        GraphNode yes = NodeFactory.create(StandardNodeType.PRINT, "yes");
        GraphNode no = NodeFactory.create(StandardNodeType.PRINT, "no");
        RecordingHelpers helpers = new RecordingHelpers()
                .input(branch, "condition", "(x > 1)")
                .target(branch, "true", yes)
                .target(branch, "false", no);

        NodeGenerationResult result = generator.generate(branch, RecordingHelpers.context(), helpers);

        assertThat(result.getLines()).containsExactly(
                "if ((x > 1)) {",
                "    // -> yes",
                "} else {",
                "    // -> no",
                "}");
        assertThat(result.isCustomExecutionHandling()).isTrue();
        assertThat(helpers.warnings()).isEmpty();
        assertThat(helpers.indentLevel()).isZero();
    }

    @Test
    void testEmptyTrueArmWarnsOnceAndStaysValid() {
        GraphNode branch = NodeFactory.create(StandardNodeType.BRANCH, "branch-1");
        RecordingHelpers helpers = new RecordingHelpers();

        List<String> lines = generator.generate(branch, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "if (true) {",
                "    // Пустая ветка",
                "}");
        assertThat(helpers.warnings()).hasSize(1);
        assertThat(helpers.warnings().get(0).getCode()).isEqualTo(CodeGenWarningCode.EMPTY_BRANCH);
        assertThat(helpers.warnings().get(0).getNodeId()).isEqualTo("branch-1");
    }
}
