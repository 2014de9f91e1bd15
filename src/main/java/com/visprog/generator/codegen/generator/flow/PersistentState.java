package com.visprog.generator.codegen.generator.flow;

import java.util.List;

import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.GraphNode;

import lombok.experimental.UtilityClass;

/**
 * Call-to-call state of Gate, DoN, DoOnce, FlipFlop and MultiGate, emitted as
 * function-local statics named {@code <kind>_<purpose>_<nodeSuffix>} and
 * registered under {@code <nodeId>-<purpose>}.
 */
@UtilityClass
class PersistentState {

    static String name(String kind, String purpose, GraphNode node) {
        return kind + "_" + purpose + "_" + NamingUtil.nodeSuffix(node.getId());
    }

    /**
     * Declares the static once per run and returns its name.
     */
    static String declare(GraphNode node, String kind, String purpose, String cppType, String initialValue,
                          GeneratorHelpers helpers, List<String> lines) {
        String key = node.getId() + "-" + purpose;
        String name = name(kind, purpose, node);
        if (!helpers.isVariableDeclared(key)) {
            lines.add(helpers.indent() + "static " + cppType + " " + name + " = " + initialValue + ";");
            helpers.declareVariable(key, name, purpose, cppType, node.getId());
        }
        return name;
    }

    /**
     * {@code if (<input>) <statement>} when the bool input has an expression.
     */
    static void onInput(GraphNode node, String inputSuffix, String statement,
                        GeneratorHelpers helpers, List<String> lines) {
        helpers.getInputExpression(node, inputSuffix)
                .ifPresent(expr -> lines.add(helpers.indent() + "if (" + expr + ") " + statement));
    }
}
