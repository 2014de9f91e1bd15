package com.visprog.generator.codegen.generator.other;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

class OtherNodeGeneratorsTest {

    @Test
    void testCommentEmitsEachLineAndStopsFlow() {
        GraphNode comment = NodeFactory.create(StandardNodeType.COMMENT, "c-1").toBuilder()
                .comment("первая строка\nsecond line")
                .build();

        NodeGenerationResult result = new CommentNodeGenerator()
                .generate(comment, RecordingHelpers.context(), new RecordingHelpers());

        assertThat(result.getLines()).containsExactly("// первая строка", "// second line");
        assertThat(result.isFollowExecutionFlow()).isFalse();
    }

    @Test
    void testCommentFallsBackToLabel() {
        GraphNode comment = NodeFactory.create(StandardNodeType.COMMENT, "c-1").toBuilder()
                .label("Note")
                .build();

        assertThat(new CommentNodeGenerator()
                .generate(comment, RecordingHelpers.context(), new RecordingHelpers()).getLines())
                .containsExactly("// Note");
    }

    @Test
    void testReroutePassesInputThrough() {
        GraphNode reroute = NodeFactory.create(StandardNodeType.REROUTE, "r-1");
        RecordingHelpers helpers = new RecordingHelpers().input(reroute, "in", "(a * 2)");

        assertThat(new RerouteNodeGenerator()
                .getOutputExpression(reroute, "r-1-out", RecordingHelpers.context(), helpers))
                .contains("(a * 2)");
        assertThat(new RerouteNodeGenerator()
                .getOutputExpression(reroute, "r-1-out", RecordingHelpers.context(), new RecordingHelpers()))
                .contains("0");
    }

    @Test
    void testFallbackLeavesMarkerAndContinues() {
        GraphNode custom = NodeFactory.create(StandardNodeType.CUSTOM, "x-1").toBuilder()
                .label("Magic")
                .build();

        NodeGenerationResult result = new FallbackNodeGenerator()
                .generate(custom, RecordingHelpers.context(), new RecordingHelpers());

        assertThat(result.getLines()).containsExactly("// TODO: Custom - Magic");
        assertThat(result.isFollowExecutionFlow()).isTrue();
    }
}
