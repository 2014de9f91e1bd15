package com.visprog.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A Blueprint graph: nodes plus execution and data edges.
 */
@Value
@Builder(toBuilder = true)
public class BlueprintGraph {

    @Builder.Default
    String id = "graph";

    @NonNull
    @Builder.Default
    String name = "";

    @Singular
    List<GraphNode> nodes;

    @Singular
    List<GraphEdge> edges;

    public Optional<GraphNode> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }

    public List<GraphNode> nodesOfType(String type) {
        return nodes.stream().filter(n -> n.getType().equals(type)).toList();
    }

    /**
     * First edge leaving {@code nodeId} through a port matching {@code portSuffix}.
     */
    public Optional<GraphEdge> findEdgeFrom(String nodeId, String portSuffix) {
        return edges.stream()
                .filter(e -> e.getSourceNode().equals(nodeId))
                .filter(e -> NodePort.idMatches(e.getSourcePort(), portSuffix))
                .findFirst();
    }

    /**
     * First edge entering {@code nodeId} through a port matching {@code portSuffix}.
     */
    public Optional<GraphEdge> findEdgeInto(String nodeId, String portSuffix) {
        return edges.stream()
                .filter(e -> e.getTargetNode().equals(nodeId))
                .filter(e -> NodePort.idMatches(e.getTargetPort(), portSuffix))
                .findFirst();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public static BlueprintGraph empty(String name) {
        return BlueprintGraph.builder().name(name).build();
    }
}
