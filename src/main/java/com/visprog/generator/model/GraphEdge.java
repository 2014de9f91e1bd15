package com.visprog.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Connection from one output port to one input port.
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {

    @NonNull
    String id;

    @NonNull
    String sourceNode;

    @NonNull
    String sourcePort;

    @NonNull
    String targetNode;

    @NonNull
    String targetPort;

    @NonNull
    EdgeKind kind;

    PortDataType dataType;

    public boolean isExecution() {
        return kind == EdgeKind.EXECUTION;
    }
}
