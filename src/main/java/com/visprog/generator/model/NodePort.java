package com.visprog.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A port on a graph node.
 *
 * Port ids are node-scoped ({@code <nodeId>-<portId>}); generators address
 * ports by the trailing portId part, see {@link #matches(String)}.
 */
@Value
@Builder(toBuilder = true)
public class NodePort {

    @NonNull
    String id;

    @Builder.Default
    String name = "";

    @NonNull
    PortDataType dataType;

    @NonNull
    PortDirection direction;

    /**
     * Position on the node, top to bottom.
     */
    int index;

    /**
     * Value entered by the user for an unconnected input (String, Number or Boolean).
     */
    Object value;

    /**
     * Value declared by the node type for an unconnected input.
     */
    Object defaultValue;

    /**
     * Optional concrete type spelling for complex types, e.g. "MyClass*".
     */
    String typeName;

    public boolean isExecution() {
        return dataType.isExecution();
    }

    public boolean matches(String suffix) {
        return idMatches(id, suffix);
    }

    /**
     * Returns the portId part of a node-scoped port id.
     */
    public String localId(String nodeId) {
        String prefix = nodeId + "-";
        return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }

    /**
     * True when {@code portId} is exactly {@code suffix} or ends with {@code "-" + suffix}.
     */
    public static boolean idMatches(String portId, String suffix) {
        if (portId == null || suffix == null || suffix.isEmpty()) {
            return false;
        }
        return portId.equals(suffix) || portId.endsWith("-" + suffix);
    }
}
