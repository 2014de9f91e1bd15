package com.visprog.generator.model;

/**
 * Classification of a graph edge.
 */
public enum EdgeKind {
    /**
     * Control flow sequencing between execution ports.
     */
    EXECUTION,

    /**
     * Value flow from an output port to an input port.
     */
    DATA;

    public static EdgeKind forDataType(PortDataType dataType) {
        return dataType == null || dataType.isExecution() ? EXECUTION : DATA;
    }
}
