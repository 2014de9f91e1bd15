package com.visprog.generator.model;

import java.util.Locale;

/**
 * Data types a node port can carry.
 */
public enum PortDataType {
    /**
     * Control flow pseudo-type. Carries no value.
     */
    EXECUTION,

    BOOL,

    /**
     * 32-bit signed integer.
     */
    INT32,

    /**
     * 64-bit signed integer.
     */
    INT64,

    FLOAT,

    DOUBLE,

    STRING,

    /**
     * Numeric vector.
     */
    VECTOR,

    OBJECT,

    /**
     * Opaque pointer.
     */
    POINTER,

    CLASS,

    ARRAY,

    /**
     * Wildcard, accepts anything except execution.
     */
    ANY;

    public boolean isExecution() {
        return this == EXECUTION;
    }

    /**
     * Parses the serialized form ("int32", "string", ...). Unknown or missing
     * values fall back to {@link #ANY}.
     */
    public static PortDataType fromString(String value) {
        if (value == null) {
            return ANY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "execution", "exec" -> EXECUTION;
            case "bool", "boolean" -> BOOL;
            case "int32", "int", "integer" -> INT32;
            case "int64", "long" -> INT64;
            case "float" -> FLOAT;
            case "double" -> DOUBLE;
            case "string", "text" -> STRING;
            case "vector" -> VECTOR;
            case "object" -> OBJECT;
            case "pointer" -> POINTER;
            case "class" -> CLASS;
            case "array" -> ARRAY;
            default -> ANY;
        };
    }

    /**
     * Serialized form used in graph documents and package definitions.
     */
    public String serializedName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
