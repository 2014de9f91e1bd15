package com.visprog.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Lines of the generated file that a node produced, 1-based and inclusive.
 */
@Value
@Builder
public class SourceMapEntry {
    String nodeId;
    int startLine;
    int endLine;
}
