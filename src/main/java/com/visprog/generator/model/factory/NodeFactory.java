package com.visprog.generator.model.factory;

import java.util.ArrayList;
import java.util.List;

import com.visprog.generator.model.EdgeKind;
import com.visprog.generator.model.FunctionParameter;
import com.visprog.generator.model.GraphEdge;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.PortDirection;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.UserFunction;

import lombok.experimental.UtilityClass;

/**
 * Creates nodes of the standard types with their port layout, and edges
 * between node ports.
 *
 * Port ids are node-scoped: a node {@code print-1} gets {@code print-1-exec-in},
 * {@code print-1-string} and {@code print-1-exec-out}.
 */
@UtilityClass
public class NodeFactory {

    /**
     * Branch count used for dynamic-port node types when none is given.
     */
    public static final int DEFAULT_BRANCH_COUNT = 2;

    public static GraphNode create(StandardNodeType type, String id) {
        return create(type, id, DEFAULT_BRANCH_COUNT);
    }

    /**
     * Creates a node; {@code branchCount} sizes the then-N / case-N / thread-N / out-N
     * ports of Sequence, Switch, Parallel and MultiGate and is ignored otherwise.
     */
    public static GraphNode create(StandardNodeType type, String id, int branchCount) {
        PortLayout layout = new PortLayout(id);
        switch (type) {
            case START, EVENT -> layout.execOut();
            case END, BREAK, CONTINUE -> layout.execIn();
            case RETURN -> layout.execIn().in("value", "Return Value", PortDataType.ANY, null);
            case BRANCH -> layout.execIn()
                    .in("condition", "Condition", PortDataType.BOOL, null)
                    .out("true", "True", PortDataType.EXECUTION)
                    .out("false", "False", PortDataType.EXECUTION);
            case FOR_LOOP -> layout.execIn()
                    .in("first", "First Index", PortDataType.INT32, 0)
                    .in("last", "Last Index", PortDataType.INT32, 10)
                    .out("loop-body", "Loop Body", PortDataType.EXECUTION)
                    .out("index", "Index", PortDataType.INT32)
                    .out("completed", "Completed", PortDataType.EXECUTION);
            case WHILE_LOOP, DO_WHILE -> layout.execIn()
                    .in("condition", "Condition", PortDataType.BOOL, null)
                    .out("loop-body", "Loop Body", PortDataType.EXECUTION)
                    .out("completed", "Completed", PortDataType.EXECUTION);
            case FOR_EACH -> layout.execIn()
                    .in("array", "Array", PortDataType.ARRAY, null)
                    .out("loop-body", "Loop Body", PortDataType.EXECUTION)
                    .out("element", "Element", PortDataType.ANY)
                    .out("index", "Index", PortDataType.INT32)
                    .out("completed", "Completed", PortDataType.EXECUTION);
            case SWITCH -> {
                layout.execIn().in("selection", "Selection", PortDataType.INT32, 0);
                for (int i = 0; i < branchCount; i++) {
                    layout.out("case-" + i, "Case " + i, PortDataType.EXECUTION);
                }
                layout.out("default", "Default", PortDataType.EXECUTION);
            }
            case SEQUENCE -> {
                layout.execIn();
                for (int i = 0; i < branchCount; i++) {
                    layout.out("then-" + i, "Then " + i, PortDataType.EXECUTION);
                }
            }
            case PARALLEL -> {
                layout.execIn();
                for (int i = 0; i < branchCount; i++) {
                    layout.out("thread-" + i, "Thread " + i, PortDataType.EXECUTION);
                }
                layout.out("completed", "Completed", PortDataType.EXECUTION);
            }
            case GATE -> layout.execIn()
                    .in("open", "Open", PortDataType.BOOL, null)
                    .in("close", "Close", PortDataType.BOOL, null)
                    .in("toggle", "Toggle", PortDataType.BOOL, null)
                    .out("exit", "Exit", PortDataType.EXECUTION);
            case DO_N -> layout.execIn()
                    .in("n", "N", PortDataType.INT32, 1)
                    .in("reset", "Reset", PortDataType.BOOL, null)
                    .out("exit", "Exit", PortDataType.EXECUTION)
                    .out("counter", "Counter", PortDataType.INT32);
            case DO_ONCE -> layout.execIn()
                    .in("reset", "Reset", PortDataType.BOOL, null)
                    .out("completed", "Completed", PortDataType.EXECUTION);
            case FLIP_FLOP -> layout.execIn()
                    .out("a", "A", PortDataType.EXECUTION)
                    .out("b", "B", PortDataType.EXECUTION)
                    .out("is-a", "Is A", PortDataType.BOOL);
            case MULTI_GATE -> {
                layout.execIn().in("reset", "Reset", PortDataType.BOOL, null);
                for (int i = 0; i < branchCount; i++) {
                    layout.out("out-" + i, "Out " + i, PortDataType.EXECUTION);
                }
            }
            case FUNCTION -> layout.execIn().execOut();
            case FUNCTION_CALL -> layout.execIn()
                    .in("target", "Target", PortDataType.OBJECT, null)
                    .execOut()
                    .out("return", "Return Value", PortDataType.ANY);
            case FUNCTION_ENTRY -> layout.execOut();
            case FUNCTION_RETURN -> layout.execIn();
            case CALL_USER_FUNCTION -> layout.execIn().execOut();
            case VARIABLE, GET_VARIABLE -> layout.out("value", "Value", PortDataType.ANY);
            case SET_VARIABLE -> layout.execIn()
                    .in("value", "", PortDataType.ANY, null)
                    .execOut()
                    .out("value", "", PortDataType.ANY);
            case ADD, SUBTRACT, MULTIPLY -> layout
                    .in("a", "A", PortDataType.FLOAT, 0)
                    .in("b", "B", PortDataType.FLOAT, 0)
                    .out("result", "Result", PortDataType.FLOAT);
            case DIVIDE -> layout
                    .in("a", "A", PortDataType.FLOAT, 0)
                    .in("b", "B", PortDataType.FLOAT, 1)
                    .out("result", "Result", PortDataType.FLOAT);
            case MODULO -> layout
                    .in("a", "A", PortDataType.INT32, 0)
                    .in("b", "B", PortDataType.INT32, 1)
                    .out("result", "Result", PortDataType.INT32);
            case EQUAL, NOT_EQUAL -> layout
                    .in("a", "A", PortDataType.ANY, null)
                    .in("b", "B", PortDataType.ANY, null)
                    .out("result", "Result", PortDataType.BOOL);
            case GREATER, LESS, GREATER_EQUAL, LESS_EQUAL -> layout
                    .in("a", "A", PortDataType.FLOAT, null)
                    .in("b", "B", PortDataType.FLOAT, null)
                    .out("result", "Result", PortDataType.BOOL);
            case AND, OR -> layout
                    .in("a", "A", PortDataType.BOOL, null)
                    .in("b", "B", PortDataType.BOOL, null)
                    .out("result", "Result", PortDataType.BOOL);
            case NOT -> layout
                    .in("a", "", PortDataType.BOOL, null)
                    .out("result", "", PortDataType.BOOL);
            case PRINT -> layout.execIn()
                    .in("string", "In String", PortDataType.STRING, "")
                    .execOut();
            case INPUT -> layout.execIn()
                    .in("prompt", "Prompt", PortDataType.STRING, "")
                    .execOut()
                    .out("value", "Value", PortDataType.STRING);
            case REROUTE -> layout
                    .in("in", "", PortDataType.ANY, null)
                    .out("out", "", PortDataType.ANY);
            case COMMENT, CUSTOM -> {
                // no ports
            }
        }
        return GraphNode.builder()
                .id(id)
                .type(type.getTag())
                .label(type.getLabel())
                .inputs(layout.inputs)
                .outputs(layout.outputs)
                .build();
    }

    /**
     * Variable declaration node whose value output carries {@code dataType}.
     */
    public static GraphNode variable(String id, String label, PortDataType dataType) {
        return new PortLayout(id).out("value", "Value", dataType)
                .toNode(StandardNodeType.VARIABLE, label);
    }

    public static GraphNode setVariable(String id, String label, PortDataType dataType) {
        return new PortLayout(id).execIn()
                .in("value", "", dataType, null)
                .execOut()
                .out("value", "", dataType)
                .toNode(StandardNodeType.SET_VARIABLE, label);
    }

    public static GraphNode getVariable(String id, String label, PortDataType dataType) {
        return new PortLayout(id).out("value", "", dataType)
                .toNode(StandardNodeType.GET_VARIABLE, label);
    }

    /**
     * Entry node of {@code function}: one data output per input parameter.
     */
    public static GraphNode functionEntry(String id, UserFunction function) {
        PortLayout layout = new PortLayout(id).execOut();
        for (FunctionParameter param : function.inputParameters()) {
            layout.out(param.getId(), param.getName(), param.getDataType());
        }
        return layout.toNode(StandardNodeType.FUNCTION_ENTRY, function.getName(), function.getId());
    }

    /**
     * Return node of {@code function}: one data input per output parameter.
     */
    public static GraphNode functionReturn(String id, UserFunction function) {
        PortLayout layout = new PortLayout(id).execIn();
        for (FunctionParameter param : function.outputParameters()) {
            layout.in(param.getId(), param.getName(), param.getDataType(), null);
        }
        return layout.toNode(StandardNodeType.FUNCTION_RETURN, "Return", function.getId());
    }

    /**
     * Call site of {@code function}, ports in declared parameter order.
     */
    public static GraphNode callUserFunction(String id, UserFunction function) {
        PortLayout layout = new PortLayout(id).execIn();
        for (FunctionParameter param : function.inputParameters()) {
            layout.in(param.getId(), param.getName(), param.getDataType(), param.getDefaultValue());
        }
        layout.execOut();
        for (FunctionParameter param : function.outputParameters()) {
            layout.out(param.getId(), param.getName(), param.getDataType());
        }
        return layout.toNode(StandardNodeType.CALL_USER_FUNCTION, function.getName(), function.getId()).toBuilder()
                .property("functionName", function.getName())
                .build();
    }

    /**
     * Edge between two node ports addressed by their portId suffix.
     *
     * @throws IllegalArgumentException if either port does not exist
     */
    public static GraphEdge edge(GraphNode source, String sourcePort, GraphNode target, String targetPort) {
        NodePort from = source.findOutput(sourcePort)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Node " + source.getId() + " has no output port " + sourcePort));
        NodePort to = target.findInput(targetPort)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Node " + target.getId() + " has no input port " + targetPort));
        return GraphEdge.builder()
                .id("edge-" + from.getId() + "-" + to.getId())
                .sourceNode(source.getId())
                .sourcePort(from.getId())
                .targetNode(target.getId())
                .targetPort(to.getId())
                .kind(EdgeKind.forDataType(from.getDataType()))
                .dataType(from.getDataType())
                .build();
    }

    /**
     * Execution edge from {@code source}'s {@code sourcePort} to {@code target}'s exec-in.
     */
    public static GraphEdge exec(GraphNode source, String sourcePort, GraphNode target) {
        return edge(source, sourcePort, target, "exec-in");
    }

    private static final class PortLayout {
        private final String nodeId;
        private final List<NodePort> inputs = new ArrayList<>();
        private final List<NodePort> outputs = new ArrayList<>();

        private PortLayout(String nodeId) {
            this.nodeId = nodeId;
        }

        PortLayout execIn() {
            return in("exec-in", "", PortDataType.EXECUTION, null);
        }

        PortLayout execOut() {
            return out("exec-out", "", PortDataType.EXECUTION);
        }

        PortLayout in(String portId, String name, PortDataType dataType, Object defaultValue) {
            inputs.add(NodePort.builder()
                    .id(nodeId + "-" + portId)
                    .name(name)
                    .dataType(dataType)
                    .direction(PortDirection.INPUT)
                    .index(inputs.size())
                    .defaultValue(defaultValue)
                    .build());
            return this;
        }

        PortLayout out(String portId, String name, PortDataType dataType) {
            outputs.add(NodePort.builder()
                    .id(nodeId + "-" + portId)
                    .name(name)
                    .dataType(dataType)
                    .direction(PortDirection.OUTPUT)
                    .index(outputs.size())
                    .build());
            return this;
        }

        GraphNode toNode(StandardNodeType type, String label) {
            return GraphNode.builder()
                    .id(nodeId)
                    .type(type.getTag())
                    .label(label)
                    .inputs(inputs)
                    .outputs(outputs)
                    .build();
        }

        GraphNode toNode(StandardNodeType type, String label, String functionId) {
            return toNode(type, label).toBuilder().property("functionId", functionId).build();
        }
    }
}
