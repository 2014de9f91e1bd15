package com.visprog.generator.model.definition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory definition lookup, keyed by type tag in registration order.
 */
public class MapNodeDefinitionProvider implements NodeDefinitionProvider {

    private final Map<String, NodeDefinition> definitions = new LinkedHashMap<>();

    public MapNodeDefinitionProvider add(NodeDefinition definition) {
        definitions.put(definition.getType(), definition);
        return this;
    }

    @Override
    public Optional<NodeDefinition> find(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    @Override
    public Collection<String> types() {
        return Collections.unmodifiableCollection(definitions.keySet());
    }

    public static MapNodeDefinitionProvider of(NodeDefinition... definitions) {
        MapNodeDefinitionProvider provider = new MapNodeDefinitionProvider();
        for (NodeDefinition definition : definitions) {
            provider.add(definition);
        }
        return provider;
    }
}
