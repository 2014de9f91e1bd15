package com.visprog.generator.codegen.generator.flow;

import java.util.ArrayList;
import java.util.List;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Runs each connected {@code thread-N} branch on its own {@code std::thread},
 * joins them all, rethrows the first exception any of them raised, then
 * continues with {@code completed}.
 */
public class ParallelNodeGenerator extends BaseNodeGenerator {

    public ParallelNodeGenerator() {
        super(StandardNodeType.PARALLEL);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        List<String> declared = numberedOutputs(node, "thread-");
        List<String> connected = declared.stream()
                .filter(suffix -> helpers.getExecutionTarget(node, suffix).isPresent())
                .toList();

        if (connected.isEmpty()) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.NO_CONNECTED_OUTPUTS,
                    "Parallel: нет подключённых потоков", "Parallel: no connected threads");
            lines.addAll(followOutput(node, "completed", helpers));
            return customExecution(lines);
        }
        if (connected.size() < declared.size()) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.UNCONNECTED_BRANCHES,
                    "Parallel: подключено " + connected.size() + " из " + declared.size() + " потоков",
                    "Parallel: " + connected.size() + " of " + declared.size() + " threads connected");
        }

        helpers.requireInclude("<thread>");
        helpers.requireInclude("<mutex>");
        helpers.requireInclude("<exception>");
        helpers.requireInclude("<vector>");

        String suffix = NamingUtil.nodeSuffix(node.getId());
        String threads = "parallel_threads_" + suffix;
        String error = "parallel_error_" + suffix;
        String mutex = "parallel_mutex_" + suffix;

        lines.add(ind + "std::vector<std::thread> " + threads + ";");
        lines.add(ind + "std::exception_ptr " + error + " = nullptr;");
        lines.add(ind + "std::mutex " + mutex + ";");

        for (String threadSuffix : connected) {
            appendThread(node, threadSuffix, threads, error, mutex, helpers, lines);
        }

        lines.add(ind + "for (auto& thread : " + threads + ") {");
        helpers.pushIndent();
        lines.add(helpers.indent() + "thread.join();");
        helpers.popIndent();
        lines.add(ind + "}");
        lines.add(ind + "if (" + error + ") {");
        helpers.pushIndent();
        lines.add(helpers.indent() + "std::rethrow_exception(" + error + ");");
        helpers.popIndent();
        lines.add(ind + "}");

        lines.addAll(followOutput(node, "completed", helpers));
        return customExecution(lines);
    }

    private void appendThread(GraphNode node, String threadSuffix, String threads, String error, String mutex,
                              GeneratorHelpers helpers, List<String> lines) {
        String ind = helpers.indent();
        lines.add(ind + threads + ".emplace_back([&]() {");
        helpers.pushIndent();
        String tryInd = helpers.indent();
        lines.add(tryInd + "try {");
        lines.addAll(nestedBlock(node, threadSuffix, helpers));
        lines.add(tryInd + "} catch (...) {");
        helpers.pushIndent();
        String catchInd = helpers.indent();
        lines.add(catchInd + "std::lock_guard<std::mutex> lock(" + mutex + ");");
        lines.add(catchInd + "if (!" + error + ") {");
        helpers.pushIndent();
        lines.add(helpers.indent() + error + " = std::current_exception();");
        helpers.popIndent();
        lines.add(catchInd + "}");
        helpers.popIndent();
        lines.add(tryInd + "}");
        helpers.popIndent();
        lines.add(ind + "});");
    }
}
