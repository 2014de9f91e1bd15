package com.visprog.generator.codegen.generator.flow;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.model.GraphNode;

import lombok.experimental.UtilityClass;

@UtilityClass
class LoopConditions {

    /**
     * Literal text comparison only, no constant folding.
     */
    static void warnIfAlwaysTrue(GraphNode node, String condition, GeneratorHelpers helpers) {
        if ("true".equals(condition)) {
            helpers.addWarning(node.getId(), CodeGenWarningCode.INFINITE_LOOP,
                    "Условие цикла всегда true: возможен бесконечный цикл",
                    "Loop condition is always true: possible infinite loop");
        }
    }
}
