package com.visprog.generator.codegen.mapper;

import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.PortDataType;

import lombok.experimental.UtilityClass;

/**
 * Maps port data types to C++ type names and default literals.
 * A missing type degrades to {@code auto} / {@code 0} instead of failing.
 */
@UtilityClass
public class PortTypeMapper {

    public static String targetType(PortDataType dataType) {
        if (dataType == null) {
            return "auto";
        }
        return switch (dataType) {
            case EXECUTION -> "void";
            case BOOL -> "bool";
            case INT32 -> "int";
            case INT64 -> "long long";
            case FLOAT -> "float";
            case DOUBLE -> "double";
            case STRING -> "std::string";
            case VECTOR -> "std::vector<float>";
            case OBJECT, POINTER -> "void*";
            case ARRAY -> "std::vector<int>";
            case CLASS, ANY -> "auto";
        };
    }

    /**
     * Type of a port, preferring its explicit type spelling when one is set.
     */
    public static String targetType(NodePort port) {
        if (port == null) {
            return "auto";
        }
        if (port.getTypeName() != null && !port.getTypeName().isBlank()) {
            return port.getTypeName();
        }
        return targetType(port.getDataType());
    }

    /**
     * Literal used when a value of the type is needed but none was supplied.
     * Execution has no value and maps to an empty string. Types spelled
     * {@code auto} get {@code 0}, since {@code auto x = {};} does not compile.
     */
    public static String defaultLiteral(PortDataType dataType) {
        if (dataType == null) {
            return "0";
        }
        return switch (dataType) {
            case EXECUTION -> "";
            case BOOL -> "false";
            case INT32 -> "0";
            case INT64 -> "0LL";
            case FLOAT -> "0.0f";
            case DOUBLE -> "0.0";
            case STRING -> "\"\"";
            case VECTOR, ARRAY -> "{}";
            case CLASS, ANY -> "0";
            case OBJECT, POINTER -> "nullptr";
        };
    }
}
