package com.visprog.generator.codegen.generator.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.generator.NodeGenerator;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.definition.CodegenTemplate;
import com.visprog.generator.model.definition.NodeDefinition;
import com.visprog.generator.model.definition.PropertyDefinition;

/**
 * Generator driven by the {@link CodegenTemplate} of a package node definition.
 *
 * Four placeholder kinds are substituted, nothing else is interpreted:
 * {@code {{input.<port>}}}, {@code {{output.<port>}}}, {@code {{prop.<id>}}}
 * and {@code {{node.label}}} / {@code {{node.labelRu}}}. Unresolvable inputs
 * and properties leave a visible marker comment in the output.
 */
public class TemplateNodeGenerator implements NodeGenerator {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\{\\{\\s*(input|output|prop|node)\\.([\\w-]+)\\s*\\}\\}");

    private final NodeDefinition definition;

    public TemplateNodeGenerator(NodeDefinition definition) {
        this.definition = definition;
    }

    @Override
    public List<String> getNodeTypes() {
        return List.of(definition.getType());
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        Optional<CodegenTemplate> codegen = definition.getCodegen().filter(CodegenTemplate::hasTemplate);
        if (codegen.isEmpty()) {
            return NodeGenerationResult.noop();
        }
        CodegenTemplate template = codegen.get();

        for (String include : template.getIncludes()) {
            helpers.requireInclude(include);
        }
        for (NodePort output : node.dataOutputs()) {
            String port = output.localId(node.getId());
            String key = node.getId() + "-" + port;
            if (!helpers.isVariableDeclared(key)) {
                helpers.declareVariable(key, outputName(node, port), port, "auto", node.getId());
            }
        }

        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();
        appendLines(lines, ind, template.getBefore(), node, helpers);
        appendLines(lines, ind, template.getTemplate(), node, helpers);
        appendLines(lines, ind, template.getAfter(), node, helpers);

        return NodeGenerationResult.code(lines, node.hasExecutionOutput());
    }

    /**
     * Declared output variable when the node already ran; for a node without
     * execution ports, the substituted template itself used as an expression.
     */
    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        String port = portId.startsWith(node.getId() + "-") ? portId.substring(node.getId().length() + 1) : portId;
        Optional<String> declared = helpers.getVariable(node.getId() + "-" + port).map(VariableInfo::getCodeName);
        if (declared.isPresent()) {
            return declared;
        }
        if (!node.hasExecutionPorts() && definition.hasTemplate()) {
            String expression = substitute(definition.getCodegen().get().getTemplate(), node, helpers).trim();
            if (expression.endsWith(";")) {
                expression = expression.substring(0, expression.length() - 1).trim();
            }
            return Optional.of(expression.isEmpty() ? "0" : expression);
        }
        return Optional.of("0");
    }

    /**
     * Replaces every placeholder in {@code text}.
     */
    String substitute(String text, GraphNode node, GeneratorHelpers helpers) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(resolve(match.group(1), match.group(2), node, helpers)));
    }

    static String outputName(GraphNode node, String port) {
        return NamingUtil.cleanId(port, 32) + "_" + NamingUtil.cleanId(node.getId(), 8);
    }

    private String resolve(String kind, String key, GraphNode node, GeneratorHelpers helpers) {
        return switch (kind) {
            case "input" -> helpers.getInputExpression(node, key).orElse("/* missing input: " + key + " */");
            case "output" -> outputName(node, key);
            case "prop" -> propertyValue(node, key).orElse("/* missing prop: " + key + " */");
            case "node" -> switch (key) {
                case "label" -> definition.getLabel();
                case "labelRu" -> definition.localizedLabel();
                default -> "/* unknown node field: " + key + " */";
            };
            default -> throw new IllegalStateException("Unexpected placeholder kind: " + kind);
        };
    }

    private Optional<String> propertyValue(GraphNode node, String propertyId) {
        return node.property(propertyId)
                .or(() -> definition.findProperty(propertyId).map(PropertyDefinition::getDefaultValue))
                .map(String::valueOf);
    }

    private void appendLines(List<String> lines, String ind, String text, GraphNode node, GeneratorHelpers helpers) {
        if (text == null || text.isEmpty()) {
            return;
        }
        for (String line : substitute(text, node, helpers).split("\n", -1)) {
            if (!line.isBlank()) {
                lines.add(ind + line);
            }
        }
    }
}
