package com.visprog.generator.codegen.generator.flow;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Runs one of the connected {@code out-K} branches per execution, round-robin
 * or at random.
 *
 * Properties: {@code isRandom} (false), {@code loop} (true: wrap around,
 * false: stay on the last branch), {@code startIndex} (0), {@code seed}
 * (random mode only, defaults to the FNV-1a hash of the node id).
 */
public class MultiGateNodeGenerator extends BaseNodeGenerator {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    public MultiGateNodeGenerator() {
        super(StandardNodeType.MULTI_GATE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        List<String> declared = numberedOutputs(node, "out-");
        List<String> connected = declared.stream()
                .filter(suffix -> helpers.getExecutionTarget(node, suffix).isPresent())
                .toList();

        if (connected.isEmpty()) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.NO_CONNECTED_OUTPUTS,
                    "MultiGate: нет подключённых выходов", "MultiGate: no connected outputs");
            lines.add(ind + "// MultiGate: нет подключённых выходов");
            return customExecution(lines);
        }
        if (connected.size() < declared.size()) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.UNCONNECTED_BRANCHES,
                    "MultiGate: подключено " + connected.size() + " из " + declared.size() + " выходов",
                    "MultiGate: " + connected.size() + " of " + declared.size() + " outputs connected");
        }

        int count = connected.size();
        String selected = PersistentState.name("multigate", "selected", node);
        if (node.booleanProperty("isRandom", false)) {
            emitRandomSelection(node, count, selected, helpers, lines);
        } else {
            emitRoundRobinSelection(node, count, selected, helpers, lines);
        }

        lines.add(ind + "switch (" + selected + ") {");
        for (int i = 0; i < count; i++) {
            lines.add(ind + "case " + i + ":");
            lines.addAll(nestedBlock(node, connected.get(i), helpers));
            helpers.pushIndent();
            lines.add(helpers.indent() + "break;");
            helpers.popIndent();
        }
        lines.add(ind + "}");

        return customExecution(lines);
    }

    private void emitRoundRobinSelection(GraphNode node, int count, String selected,
                                         GeneratorHelpers helpers, List<String> lines) {
        String ind = helpers.indent();
        int start = Math.min(Math.max(node.intProperty("startIndex", 0), 0), count - 1);
        String index = PersistentState.declare(node, "multigate", "index", "int",
                String.valueOf(start), helpers, lines);
        PersistentState.onInput(node, "reset", index + " = " + start + ";", helpers, lines);

        lines.add(ind + "const int " + selected + " = " + index + ";");
        if (node.booleanProperty("loop", true)) {
            lines.add(ind + index + " = (" + index + " + 1) % " + count + ";");
        } else {
            lines.add(ind + "if (" + index + " < " + (count - 1) + ") " + index + "++;");
        }
    }

    private void emitRandomSelection(GraphNode node, int count, String selected,
                                     GeneratorHelpers helpers, List<String> lines) {
        String ind = helpers.indent();
        helpers.requireInclude("<random>");

        String rng = PersistentState.name("multigate", "rng", node);
        if (!helpers.isVariableDeclared(node.getId() + "-rng")) {
            lines.add(ind + "static std::mt19937 " + rng + "(" + seedFor(node) + "u);");
            helpers.declareVariable(node.getId() + "-rng", rng, "rng", "std::mt19937", node.getId());
        }
        String dist = PersistentState.name("multigate", "dist", node);
        lines.add(ind + "std::uniform_int_distribution<int> " + dist + "(0, " + (count - 1) + ");");
        lines.add(ind + "const int " + selected + " = " + dist + "(" + rng + ");");
    }

    /**
     * Explicit {@code seed} property when it is a non-negative integer, else
     * the FNV-1a hash of the node id.
     */
    static String seedFor(GraphNode node) {
        Optional<String> explicit = node.stringProperty("seed").map(String::trim);
        if (explicit.isPresent() && explicit.get().matches("\\d{1,10}")
                && Long.parseLong(explicit.get()) <= 0xFFFFFFFFL) {
            return explicit.get();
        }
        return Integer.toUnsignedString(fnv1a(node.getId()));
    }

    static int fnv1a(String text) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
