package com.visprog.generator.codegen.generator.math;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Divide and Modulo: {@code b} defaults to 1, and a literal zero divisor is
 * reported but still emitted.
 */
public class DivisionNodeGenerator extends BinaryOperatorNodeGenerator {

    private final boolean modulo;

    private DivisionNodeGenerator(StandardNodeType type, String operator, boolean modulo) {
        super(type, operator, "0", "1");
        this.modulo = modulo;
    }

    public static DivisionNodeGenerator divide() {
        return new DivisionNodeGenerator(StandardNodeType.DIVIDE, "/", false);
    }

    public static DivisionNodeGenerator modulo() {
        return new DivisionNodeGenerator(StandardNodeType.MODULO, "%", true);
    }

    @Override
    protected void checkOperands(GraphNode node, String a, String b, GeneratorHelpers helpers) {
        if (modulo && "0".equals(b)) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.MODULO_BY_ZERO,
                    "Остаток от деления на ноль", "Modulo by zero");
        } else if (!modulo && ("0".equals(b) || "0.0".equals(b))) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.DIVISION_BY_ZERO,
                    "Деление на ноль", "Division by zero");
        }
    }
}
