package com.visprog.generator.codegen.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Node type tag to generator lookup.
 *
 * Registering a tag twice keeps the later generator; this is how package
 * templates replace standard behaviour. Built once, then only read.
 */
public class NodeGeneratorRegistry {
    private static final Logger log = LoggerFactory.getLogger(NodeGeneratorRegistry.class);

    private final Map<String, NodeGenerator> generators = new LinkedHashMap<>();

    public void register(NodeGenerator generator) {
        for (String nodeType : generator.getNodeTypes()) {
            NodeGenerator previous = generators.put(nodeType, generator);
            if (previous != null && previous != generator) {
                log.warn("Generator for node type {} already registered ({}), replacing with {}",
                        nodeType, previous.getClass().getSimpleName(), generator.getClass().getSimpleName());
            } else {
                log.debug("Registered {} for node type {}", generator.getClass().getSimpleName(), nodeType);
            }
        }
    }

    public Optional<NodeGenerator> get(String nodeType) {
        return Optional.ofNullable(generators.get(nodeType));
    }

    public boolean has(String nodeType) {
        return generators.containsKey(nodeType);
    }

    public List<String> getSupportedTypes() {
        return List.copyOf(generators.keySet());
    }

    /**
     * Registered generators, each once even when it owns several tags.
     */
    public List<NodeGenerator> getAll() {
        Set<NodeGenerator> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<NodeGenerator> all = new ArrayList<>();
        for (NodeGenerator generator : generators.values()) {
            if (seen.add(generator)) {
                all.add(generator);
            }
        }
        return all;
    }
}
