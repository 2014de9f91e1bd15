package com.visprog.generator.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visprog.generator.codegen.diagnostics.CodeGenErrorCode;
import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.generator.NodeGenerator;
import com.visprog.generator.codegen.generator.NodeGeneratorRegistry;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.model.BlueprintGraph;
import com.visprog.generator.model.GraphEdge;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.UserFunction;
import com.visprog.generator.model.definition.NodeDefinition;
import com.visprog.generator.model.definition.NodeDefinitionProvider;

/**
 * Walks the execution chains of one graph and hands each node to its
 * generator, over one {@link GenerationContext}.
 *
 * Emitted node lines are framed by internal marker lines (see
 * {@link #BEGIN_MARK}) that the driver turns into the source map and strips
 * before the code is returned.
 */
class GraphTraversal implements GeneratorHelpers {
    private static final Logger log = LoggerFactory.getLogger(GraphTraversal.class);

    static final char MARK = '\u0001';
    static final String BEGIN_MARK = MARK + "begin:";
    static final String END_MARK = MARK + "end:";

    private static final String EXEC_OUT = "exec-out";

    private final GenerationContext context;
    private final NodeGeneratorRegistry registry;
    private final NodeDefinitionProvider definitions;

    GraphTraversal(GenerationContext context, NodeGeneratorRegistry registry, NodeDefinitionProvider definitions) {
        this.context = context;
        this.registry = registry;
        this.definitions = definitions;
    }

    GenerationContext getContext() {
        return context;
    }

    static boolean isMarker(String line) {
        return !line.isEmpty() && line.charAt(0) == MARK;
    }

    /**
     * Execution chain from {@code start}: every node once, following the
     * default {@code exec-out} successor while generators ask for it.
     */
    @Override
    public List<String> generateFromNode(GraphNode start) {
        List<String> lines = new ArrayList<>();
        context.enterNestedBlock();
        try {
            if (context.getNestingDepth() > context.getOptions().getMaxNestingDepth()) {
                addError(start.getId(), CodeGenErrorCode.NESTING_TOO_DEEP,
                        "Превышена максимальная глубина вложенности (" + context.getOptions().getMaxNestingDepth() + ")",
                        "Maximum nesting depth exceeded (" + context.getOptions().getMaxNestingDepth() + ")");
                lines.add(indent() + "// Превышена глубина вложенности");
                return lines;
            }

            GraphNode current = start;
            while (current != null && context.markProcessed(current.getId())) {
                NodeGenerationResult result = emit(current, lines);
                if (!result.isFollowExecutionFlow() || result.isCustomExecutionHandling()) {
                    break;
                }
                current = getExecutionTarget(current, EXEC_OUT).orElse(null);
            }
            return lines;
        } finally {
            context.exitNestedBlock();
        }
    }

    private NodeGenerationResult emit(GraphNode node, List<String> lines) {
        String ind = indent();
        Optional<NodeGenerator> generator = registry.get(node.getType());

        NodeGenerationResult result;
        if (generator.isPresent()) {
            result = generator.get().generate(node, context, this);
        } else {
            log.warn("No generator registered for node type {} (node {})", node.getType(), node.getId());
            addError(node.getId(), CodeGenErrorCode.UNKNOWN_NODE_TYPE,
                    unknownTypeMessage(node.getType()), unknownTypeMessageEn(node.getType()));
            result = NodeGenerationResult.code(List.of(ind + "// Неподдерживаемый тип: " + node.getType()), true);
        }
        log.debug("Generated node {} ({}) at indent {}: {} lines", node.getId(), node.getType(),
                context.getIndentLevel(), result.getLines().size());

        if (result.isEmpty()) {
            return result;
        }

        GenerationOptions options = context.getOptions();
        lines.add(BEGIN_MARK + node.getId());
        if (options.isIncludeLocalizedComments()) {
            localizedComment(node).ifPresent(comment -> lines.add(ind + comment));
        }
        if (options.isIncludeSourceMarkers()) {
            lines.add(ind + "// multicode:begin node=\"" + node.getId() + "\"");
        }
        lines.addAll(result.getLines());
        if (options.isIncludeSourceMarkers()) {
            lines.add(ind + "// multicode:end");
        }
        lines.add(END_MARK + node.getId());
        return result;
    }

    /**
     * {@code // <type label>: <label>} for nodes the user renamed.
     */
    private Optional<String> localizedComment(GraphNode node) {
        String label = node.displayLabel();
        if (label == null || label.isBlank() || label.equals(node.getType())) {
            return Optional.empty();
        }

        Optional<StandardNodeType> standard = StandardNodeType.fromTag(node.getType());
        if (standard.isPresent()) {
            if (label.equals(standard.get().getLabel()) || label.equals(standard.get().getLabelRu())) {
                return Optional.empty();
            }
            return Optional.of("// " + standard.get().getLabelRu() + ": " + label);
        }

        Optional<NodeDefinition> definition = definitions == null ? Optional.empty() : definitions.find(node.getType());
        if (definition.isPresent()) {
            if (label.equals(definition.get().getLabel()) || label.equals(definition.get().localizedLabel())) {
                return Optional.empty();
            }
            return Optional.of("// " + definition.get().localizedLabel() + ": " + label);
        }
        return Optional.of("// " + node.getType() + ": " + label);
    }

    @Override
    public String indent() {
        return context.indent();
    }

    @Override
    public Optional<String> getInputExpression(GraphNode node, String portSuffix) {
        BlueprintGraph graph = context.getGraph();
        Optional<NodePort> port = findDataInput(node, portSuffix);

        Optional<GraphEdge> edge = port.isPresent()
                ? incomingEdge(node, port.get())
                : graph.findEdgeInto(node.getId(), portSuffix);
        if (edge.isPresent()) {
            Optional<GraphNode> source = graph.findNode(edge.get().getSourceNode());
            if (source.isPresent()) {
                return Optional.of(getOutputExpression(source.get(), edge.get().getSourcePort()));
            }
        }

        if (port.isEmpty()) {
            return Optional.empty();
        }
        if (port.get().getValue() != null) {
            return Optional.of(literal(port.get().getValue(), port.get().getDataType()));
        }
        if (port.get().getDefaultValue() != null) {
            return Optional.of(literal(port.get().getDefaultValue(), port.get().getDataType()));
        }
        return Optional.empty();
    }

    @Override
    public String getOutputExpression(GraphNode node, String portId) {
        String key = node.getId() + "#" + portId;
        if (!context.beginResolving(key)) {
            addError(node.getId(), CodeGenErrorCode.CYCLE_DETECTED,
                    "Циклическая зависимость данных через порт " + portId,
                    "Data dependency cycle through port " + portId);
            return "0";
        }
        try {
            return registry.get(node.getType())
                    .flatMap(generator -> generator.getOutputExpression(node, portId, context, this))
                    .orElse("0");
        } finally {
            context.endResolving(key);
        }
    }

    /**
     * Only execution outputs are considered, so {@code "a"} never matches a
     * data port such as {@code "is-a"}.
     */
    @Override
    public Optional<GraphNode> getExecutionTarget(GraphNode node, String portSuffix) {
        Optional<NodePort> port = findPort(node.getOutputs(), node, portSuffix, true);
        if (port.isEmpty()) {
            return Optional.empty();
        }
        String portId = port.get().getId();
        String localId = port.get().localId(node.getId());
        return context.getGraph().getEdges().stream()
                .filter(e -> e.getSourceNode().equals(node.getId()))
                .filter(e -> e.getSourcePort().equals(portId) || e.getSourcePort().equals(localId))
                .findFirst()
                .flatMap(e -> context.getGraph().findNode(e.getTargetNode()));
    }

    @Override
    public void pushIndent() {
        context.pushIndent();
    }

    @Override
    public void popIndent() {
        context.popIndent();
    }

    @Override
    public void addWarning(String nodeId, CodeGenWarningCode code, String message, String messageEn) {
        context.getDiagnostics().addWarning(nodeId, code, message, messageEn);
    }

    @Override
    public void addError(String nodeId, CodeGenErrorCode code, String message, String messageEn) {
        context.getDiagnostics().addError(nodeId, code, message, messageEn);
    }

    @Override
    public boolean isVariableDeclared(String key) {
        return context.isVariableDeclared(key);
    }

    @Override
    public void declareVariable(String key, String codeName, String originalName, String cppType, String nodeId) {
        context.declareVariable(key, VariableInfo.builder()
                .codeName(codeName)
                .originalName(originalName)
                .cppType(cppType)
                .nodeId(nodeId)
                .build());
    }

    @Override
    public Optional<VariableInfo> getVariable(String key) {
        return context.getVariable(key);
    }

    @Override
    public void requireInclude(String header) {
        context.getIncludes().addInclude(header);
    }

    @Override
    public Optional<UserFunction> currentFunction() {
        return context.getCurrentFunction();
    }

    @Override
    public List<UserFunction> functions() {
        return context.getFunctions();
    }

    /**
     * Reports nodes with execution ports that no chain reached. Comments and
     * pure nodes are never reported.
     */
    void reportUnusedNodes() {
        for (GraphNode node : context.getGraph().getNodes()) {
            if (context.isProcessed(node.getId())
                    || StandardNodeType.COMMENT.is(node)
                    || !node.hasExecutionPorts()) {
                continue;
            }
            addWarning(node.getId(), CodeGenWarningCode.UNUSED_NODE,
                    "Узел \"" + node.displayLabel() + "\" не достижим из Start",
                    "Node \"" + node.displayLabel() + "\" is not reachable from Start");
        }
    }

    static String unknownTypeMessage(String type) {
        return "Неизвестный тип узла: " + type;
    }

    static String unknownTypeMessageEn(String type) {
        return "Unknown node type: " + type;
    }

    private Optional<NodePort> findDataInput(GraphNode node, String suffix) {
        return findPort(node.getInputs(), node, suffix, false);
    }

    /**
     * Port whose local id equals {@code suffix}, else the first whose id ends
     * with it.
     */
    private static Optional<NodePort> findPort(List<NodePort> ports, GraphNode node, String suffix, boolean execution) {
        List<NodePort> candidates = ports.stream().filter(p -> p.isExecution() == execution).toList();
        return candidates.stream()
                .filter(p -> p.localId(node.getId()).equals(suffix))
                .findFirst()
                .or(() -> candidates.stream().filter(p -> p.matches(suffix)).findFirst());
    }

    private Optional<GraphEdge> incomingEdge(GraphNode node, NodePort port) {
        String localId = port.localId(node.getId());
        return context.getGraph().getEdges().stream()
                .filter(e -> e.getTargetNode().equals(node.getId()))
                .filter(e -> e.getTargetPort().equals(port.getId()) || e.getTargetPort().equals(localId))
                .findFirst();
    }

    /**
     * C++ literal of a port value: strings on string ports are quoted and
     * escaped, everything else is written as is.
     */
    static String literal(Object value, PortDataType dataType) {
        if (dataType == PortDataType.STRING) {
            String text = String.valueOf(value)
                    .replace("\\", "\\\\")
                    .replace("\"", "\\\"")
                    .replace("\n", "\\n");
            return "\"" + text + "\"";
        }
        return String.valueOf(value);
    }
}
