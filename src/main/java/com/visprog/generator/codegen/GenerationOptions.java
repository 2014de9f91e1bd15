package com.visprog.generator.codegen;

import lombok.Builder;
import lombok.Data;

/**
 * Options for one generation request.
 */
@Data
@Builder(toBuilder = true)
public class GenerationOptions {

    /**
     * Emit a {@code // <Russian type label>: <node label>} line above nodes
     * whose label differs from their type's default labels.
     */
    @Builder.Default
    private boolean includeLocalizedComments = true;

    /**
     * Wrap each node's lines in {@code // multicode:begin node="..."} / {@code // multicode:end}.
     */
    @Builder.Default
    private boolean includeSourceMarkers = false;

    /**
     * Spaces per indentation level.
     */
    @Builder.Default
    private int indentSize = 4;

    /**
     * Emit the header comment and include directives.
     */
    @Builder.Default
    private boolean includeHeaders = true;

    /**
     * Wrap the main graph in {@code int main() { ... }}.
     */
    @Builder.Default
    private boolean generateMainWrapper = true;

    /**
     * Name shown in the header, the graph's own name when not set.
     */
    private String graphName;

    /**
     * Nested blocks deeper than this are replaced by an error placeholder.
     */
    @Builder.Default
    private int maxNestingDepth = 64;

    /**
     * Add the generation time to the header. Off by default so that
     * the same graph always yields the same text.
     */
    @Builder.Default
    private boolean includeTimestamp = false;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
