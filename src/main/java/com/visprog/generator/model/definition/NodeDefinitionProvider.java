package com.visprog.generator.model.definition;

import java.util.Collection;
import java.util.Optional;

/**
 * Lookup of package node definitions by type tag.
 */
public interface NodeDefinitionProvider {

    Optional<NodeDefinition> find(String type);

    /**
     * All node types this provider knows about.
     */
    Collection<String> types();
}
