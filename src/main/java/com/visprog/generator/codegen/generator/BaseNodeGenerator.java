package com.visprog.generator.codegen.generator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.StandardNodeType;

/**
 * Common plumbing for generators of standard node types.
 */
public abstract class BaseNodeGenerator implements NodeGenerator {

    private final List<String> nodeTypes;

    protected BaseNodeGenerator(StandardNodeType... types) {
        this.nodeTypes = Arrays.stream(types).map(StandardNodeType::getTag).toList();
    }

    @Override
    public List<String> getNodeTypes() {
        return nodeTypes;
    }

    protected NodeGenerationResult noop() {
        return NodeGenerationResult.noop();
    }

    protected NodeGenerationResult code(List<String> lines) {
        return NodeGenerationResult.code(lines, true);
    }

    protected NodeGenerationResult code(List<String> lines, boolean followExecutionFlow) {
        return NodeGenerationResult.code(lines, followExecutionFlow);
    }

    protected NodeGenerationResult customExecution(List<String> lines) {
        return NodeGenerationResult.customExecution(lines);
    }

    /**
     * Lines of the chain behind an execution output, one indentation level
     * deeper than the caller. Empty when the output is not connected.
     */
    protected List<String> nestedBlock(GraphNode node, String portSuffix, GeneratorHelpers helpers) {
        Optional<GraphNode> target = helpers.getExecutionTarget(node, portSuffix);
        if (target.isEmpty()) {
            return List.of();
        }
        helpers.pushIndent();
        try {
            return helpers.generateFromNode(target.get());
        } finally {
            helpers.popIndent();
        }
    }

    /**
     * Lines of the chain behind an execution output at the caller's indentation.
     */
    protected List<String> followOutput(GraphNode node, String portSuffix, GeneratorHelpers helpers) {
        return helpers.getExecutionTarget(node, portSuffix)
                .map(helpers::generateFromNode)
                .orElse(List.of());
    }

    /**
     * Suffixes ({@code "case-0"}, {@code "case-1"}, ...) of the outputs named
     * {@code prefix + N}, in ascending N.
     */
    protected static List<String> numberedOutputs(GraphNode node, String prefix) {
        List<NumberedPort> ports = new ArrayList<>();
        for (NodePort port : node.getOutputs()) {
            int at = port.getId().lastIndexOf(prefix);
            if (at < 0 || (at > 0 && port.getId().charAt(at - 1) != '-')) {
                continue;
            }
            String tail = port.getId().substring(at + prefix.length());
            if (tail.matches("\\d{1,9}")) {
                ports.add(new NumberedPort(Integer.parseInt(tail), prefix + tail));
            }
        }
        ports.sort(Comparator.comparingInt(NumberedPort::number));
        return ports.stream().map(NumberedPort::suffix).toList();
    }

    /**
     * Number part of a suffix produced by {@link #numberedOutputs}.
     */
    protected static String numberOf(String suffix) {
        return suffix.substring(suffix.lastIndexOf('-') + 1);
    }

    private static final class NumberedPort {
        private final int number;
        private final String suffix;

        private NumberedPort(int number, String suffix) {
            this.number = number;
            this.suffix = suffix;
        }

        int number() {
            return number;
        }

        String suffix() {
            return suffix;
        }
    }
}
