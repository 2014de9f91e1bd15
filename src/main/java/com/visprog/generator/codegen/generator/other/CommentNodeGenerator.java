package com.visprog.generator.codegen.generator.other;

import java.util.ArrayList;
import java.util.List;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * One {@code //} line per line of the node comment, or of the label when
 * there is no comment. Has no execution flow.
 */
public class CommentNodeGenerator extends BaseNodeGenerator {

    public CommentNodeGenerator() {
        super(StandardNodeType.COMMENT);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String text = node.getComment() != null ? node.getComment() : node.getLabel();
        if (text != null && !text.isEmpty()) {
            for (String line : text.split("\n", -1)) {
                lines.add(ind + "// " + line);
            }
        }

        return code(lines, false);
    }
}
