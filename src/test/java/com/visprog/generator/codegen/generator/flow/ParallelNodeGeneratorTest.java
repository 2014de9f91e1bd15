package com.visprog.generator.codegen.generator.flow;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

class ParallelNodeGeneratorTest {

    private final ParallelNodeGenerator generator = new ParallelNodeGenerator();

    @Test
    void testThreadsAreJoinedAndFirstErrorRethrown() {
        GraphNode parallel = NodeFactory.create(StandardNodeType.PARALLEL, "par-1", 1);
        RecordingHelpers helpers = new RecordingHelpers()
                .target(parallel, "thread-0", NodeFactory.create(StandardNodeType.PRINT, "work"))
                .target(parallel, "completed", NodeFactory.create(StandardNodeType.END, "after"));

        List<String> lines = generator.generate(parallel, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "std::vector<std::thread> parallel_threads_par1;",
                "std::exception_ptr parallel_error_par1 = nullptr;",
                "std::mutex parallel_mutex_par1;",
                "parallel_threads_par1.emplace_back([&]() {",
                "    try {",
                "        // -> work",
                "    } catch (...) {",
                "        std::lock_guard<std::mutex> lock(parallel_mutex_par1);",
                "        if (!parallel_error_par1) {",
                "            parallel_error_par1 = std::current_exception();",
                "        }",
                "    }",
                "});",
                "for (auto& thread : parallel_threads_par1) {",
                "    thread.join();",
                "}",
                "if (parallel_error_par1) {",
                "    std::rethrow_exception(parallel_error_par1);",
                "}",
                "// -> after");
        assertThat(helpers.includes()).contains("<thread>", "<mutex>", "<exception>", "<vector>");
        assertThat(helpers.indentLevel()).isZero();
    }

    @Test
    void testPartiallyConnectedWarns() {
        GraphNode parallel = NodeFactory.create(StandardNodeType.PARALLEL, "par-1", 3);
        RecordingHelpers helpers = new RecordingHelpers()
                .target(parallel, "thread-1", NodeFactory.create(StandardNodeType.PRINT, "work"));

        generator.generate(parallel, RecordingHelpers.context(), helpers);

        assertThat(helpers.warnings()).extracting(w -> w.getCode())
                .containsExactly(CodeGenWarningCode.UNCONNECTED_BRANCHES);
    }

    @Test
    void testNothingConnectedFallsThroughToCompleted() {
        GraphNode parallel = NodeFactory.create(StandardNodeType.PARALLEL, "par-1", 2);
        RecordingHelpers helpers = new RecordingHelpers()
                .target(parallel, "completed", NodeFactory.create(StandardNodeType.END, "after"));

        List<String> lines = generator.generate(parallel, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly("// -> after");
        assertThat(helpers.warnings()).extracting(w -> w.getCode())
                .containsExactly(CodeGenWarningCode.NO_CONNECTED_OUTPUTS);
        assertThat(helpers.includes()).isEmpty();
    }
}
