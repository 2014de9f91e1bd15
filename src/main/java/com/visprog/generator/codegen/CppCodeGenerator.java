package com.visprog.generator.codegen;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visprog.generator.codegen.diagnostics.CodeGenError;
import com.visprog.generator.codegen.diagnostics.CodeGenErrorCode;
import com.visprog.generator.codegen.generator.NodeGeneratorRegistries;
import com.visprog.generator.codegen.generator.NodeGeneratorRegistry;
import com.visprog.generator.codegen.generator.function.FunctionEntryNodeGenerator;
import com.visprog.generator.codegen.model.core.context.CodeGenDiagnostics;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.GenerationStats;
import com.visprog.generator.codegen.model.core.context.SourceMapEntry;
import com.visprog.generator.codegen.render.CppSourceRenderer;
import com.visprog.generator.codegen.render.CppTranslationUnit;
import com.visprog.generator.codegen.util.IncludeManager;
import com.visprog.generator.model.BlueprintGraph;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.UserFunction;
import com.visprog.generator.model.definition.NodeDefinitionProvider;

/**
 * Generates a C++ translation unit from a Blueprint graph and its user
 * functions.
 *
 * Each request builds its own {@link GenerationContext}s; the registry is only
 * read, so one instance can serve concurrent requests.
 */
public class CppCodeGenerator implements CodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CppCodeGenerator.class);

    private static final List<String> STANDARD_INCLUDES = List.of("<iostream>", "<string>", "<vector>");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    private static final Pattern RETURN_STATEMENT = Pattern.compile("return(?![A-Za-z0-9_])");

    private final NodeGeneratorRegistry registry;
    private final NodeDefinitionProvider definitions;
    private final CppSourceRenderer renderer;
    private final Clock clock;

    public CppCodeGenerator() {
        this(NodeGeneratorRegistries.standard(), null);
    }

    public CppCodeGenerator(NodeGeneratorRegistry registry) {
        this(registry, null);
    }

    /**
     * @param definitions package node definitions, used for the labels of
     *                    package node types; may be null
     */
    public CppCodeGenerator(NodeGeneratorRegistry registry, NodeDefinitionProvider definitions) {
        this(registry, definitions, Clock.systemDefaultZone());
    }

    CppCodeGenerator(NodeGeneratorRegistry registry, NodeDefinitionProvider definitions, Clock clock) {
        this.registry = registry;
        this.definitions = definitions;
        this.renderer = new CppSourceRenderer();
        this.clock = clock;
    }

    /**
     * Generator over the standard node types plus the templates of every
     * type {@code provider} knows.
     */
    public static CppCodeGenerator withPackages(NodeDefinitionProvider provider) {
        return new CppCodeGenerator(NodeGeneratorRegistries.withPackages(provider), provider);
    }

    @Override
    public String getLanguage() {
        return "cpp";
    }

    @Override
    public List<String> getSupportedNodeTypes() {
        return registry.getSupportedTypes();
    }

    @Override
    public GenerationCheckResult canGenerate(BlueprintGraph graph) {
        List<CodeGenError> errors = new ArrayList<>();

        List<GraphNode> starts = graph.nodesOfType(StandardNodeType.START.getTag());
        if (starts.isEmpty()) {
            errors.add(CodeGenError.builder()
                    .code(CodeGenErrorCode.NO_START_NODE)
                    .message("Граф должен содержать узел \"Начало\"")
                    .messageEn("Graph must contain a Start node")
                    .build());
        }
        for (int i = 1; i < starts.size(); i++) {
            errors.add(CodeGenError.builder()
                    .nodeId(starts.get(i).getId())
                    .code(CodeGenErrorCode.MULTIPLE_START_NODES)
                    .message("Граф содержит более одного узла \"Начало\"")
                    .messageEn("Graph contains more than one Start node")
                    .build());
        }
        for (GraphNode node : graph.getNodes()) {
            if (!registry.has(node.getType())) {
                errors.add(CodeGenError.builder()
                        .nodeId(node.getId())
                        .code(CodeGenErrorCode.UNKNOWN_NODE_TYPE)
                        .message(GraphTraversal.unknownTypeMessage(node.getType()))
                        .messageEn(GraphTraversal.unknownTypeMessageEn(node.getType()))
                        .build());
            }
        }

        return GenerationCheckResult.builder()
                .canGenerate(errors.isEmpty())
                .errors(errors)
                .build();
    }

    @Override
    public CodeGenerationResult generate(BlueprintGraph graph, List<UserFunction> functions, GenerationOptions options) {
        long startTime = System.currentTimeMillis();
        GenerationOptions effective = options == null ? GenerationOptions.defaults() : options;
        List<UserFunction> scope = functions == null ? List.of() : List.copyOf(functions);
        String graphName = effective.getGraphName() != null ? effective.getGraphName() : graph.getName();

        log.info("Generating C++ for graph '{}' ({} nodes, {} functions)",
                graphName, graph.getNodes().size(), scope.size());

        GenerationCheckResult check = canGenerate(graph);
        Optional<GraphNode> start = graph.nodesOfType(StandardNodeType.START.getTag()).stream().findFirst();
        if (start.isEmpty() && !graph.isEmpty()) {
            log.info("Graph '{}' rejected: {}", graphName, check.getErrors());
            return CodeGenerationResult.failure(check.getErrors(), GenerationStats.builder()
                    .generationTimeMillis(System.currentTimeMillis() - startTime)
                    .build());
        }

        CodeGenDiagnostics diagnostics = new CodeGenDiagnostics();
        check.getErrors().stream()
                .filter(e -> e.getCode() != CodeGenErrorCode.NO_START_NODE)
                .forEach(diagnostics::addError);
        IncludeManager includes = new IncludeManager();
        includes.addIncludes(STANDARD_INCLUDES);
        int nodesProcessed = 0;

        // main graph
        GenerationContext mainContext = GenerationContext.builder()
                .graph(graph)
                .options(effective)
                .functions(scope)
                .build();
        if (effective.isGenerateMainWrapper()) {
            mainContext.startIndentAt(1);
        }
        GraphTraversal mainTraversal = new GraphTraversal(mainContext, registry, definitions);
        List<String> body = start.map(mainTraversal::generateFromNode).orElse(List.of());
        mainTraversal.reportUnusedNodes();
        List<String> mainLines = wrapMain(body, effective);
        diagnostics.merge(mainContext.getDiagnostics());
        includes.addIncludes(mainContext.getIncludes().getIncludes());
        nodesProcessed += mainContext.getProcessedNodes().size();

        // functions, each in its own context
        CppTranslationUnit.CppTranslationUnitBuilder unit = CppTranslationUnit.builder()
                .includeHeaders(effective.isIncludeHeaders())
                .graphName(graphName)
                .mainLines(mainLines);
        for (UserFunction function : scope) {
            GenerationContext functionContext = GenerationContext.builder()
                    .graph(function.getGraph())
                    .options(effective)
                    .currentFunction(function)
                    .functions(scope)
                    .build();
            functionContext.startIndentAt(1);
            GraphTraversal functionTraversal = new GraphTraversal(functionContext, registry, definitions);

            List<String> functionLines = new ArrayList<>();
            String signature = FunctionEntryNodeGenerator.signature(function);
            functionLines.add(signature + " {");
            function.getGraph().nodesOfType(StandardNodeType.FUNCTION_ENTRY.getTag()).stream()
                    .findFirst()
                    .ifPresent(entry -> functionLines.addAll(functionTraversal.generateFromNode(entry)));
            functionLines.add("}");
            functionTraversal.reportUnusedNodes();

            unit.forwardDeclaration(signature);
            FunctionEntryNodeGenerator.resultTypeDeclaration(function).ifPresent(declaration -> {
                unit.resultType(declaration);
                includes.addInclude("<tuple>");
            });
            unit.functionUnit(functionLines);

            diagnostics.merge(functionContext.getDiagnostics());
            includes.addIncludes(functionContext.getIncludes().getIncludes());
            nodesProcessed += functionContext.getProcessedNodes().size();
            log.debug("Generated function {} ({} lines)", signature, functionLines.size());
        }

        unit.includes(includes.getIncludes());
        if (effective.isIncludeTimestamp()) {
            unit.generatedAt(LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(TIMESTAMP));
        }

        String rendered = renderer.render(unit.build());
        List<SourceMapEntry> sourceMap = new ArrayList<>();
        String code = stripMarkers(rendered, sourceMap);

        GenerationStats stats = GenerationStats.builder()
                .nodesProcessed(nodesProcessed)
                .linesOfCode(countLinesOfCode(code))
                .generationTimeMillis(System.currentTimeMillis() - startTime)
                .build();

        log.info("Generated {} lines for graph '{}' in {} ms ({} errors, {} warnings)",
                stats.getLinesOfCode(), graphName, stats.getGenerationTimeMillis(),
                diagnostics.getErrors().size(), diagnostics.getWarnings().size());

        return CodeGenerationResult.builder()
                .success(!diagnostics.hasErrors())
                .code(code)
                .includes(includes.getIncludes())
                .errors(List.copyOf(diagnostics.getErrors()))
                .warnings(List.copyOf(diagnostics.getWarnings()))
                .sourceMap(List.copyOf(sourceMap))
                .stats(stats)
                .build();
    }

    /**
     * Wraps the main body in {@code int main()}, adding {@code return 0;}
     * unless the last statement already returns.
     */
    static List<String> wrapMain(List<String> body, GenerationOptions options) {
        if (!options.isGenerateMainWrapper()) {
            return body;
        }
        List<String> lines = new ArrayList<>(body.size() + 3);
        lines.add("int main() {");
        lines.addAll(body);
        String last = body.stream()
                .filter(line -> !GraphTraversal.isMarker(line) && !line.isBlank())
                .reduce((first, second) -> second)
                .orElse("");
        if (!RETURN_STATEMENT.matcher(last.trim()).lookingAt()) {
            lines.add(" ".repeat(options.getIndentSize()) + "return 0;");
        }
        lines.add("}");
        return lines;
    }

    /**
     * Removes the node marker lines from {@code rendered} and records the
     * 1-based line range between each begin/end pair.
     */
    static String stripMarkers(String rendered, List<SourceMapEntry> sourceMap) {
        StringBuilder code = new StringBuilder(rendered.length());
        Deque<String> openNodes = new ArrayDeque<>();
        Deque<Integer> openLines = new ArrayDeque<>();
        int lineNumber = 0;

        String[] lines = rendered.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.startsWith(GraphTraversal.BEGIN_MARK)) {
                openNodes.push(line.substring(GraphTraversal.BEGIN_MARK.length()));
                openLines.push(lineNumber + 1);
            } else if (line.startsWith(GraphTraversal.END_MARK)) {
                String nodeId = openNodes.pop();
                int startLine = openLines.pop();
                if (lineNumber >= startLine) {
                    sourceMap.add(SourceMapEntry.builder()
                            .nodeId(nodeId)
                            .startLine(startLine)
                            .endLine(lineNumber)
                            .build());
                }
            } else {
                code.append(line);
                if (i < lines.length - 1) {
                    code.append('\n');
                }
                lineNumber++;
            }
        }

        sourceMap.sort(Comparator.comparingInt(SourceMapEntry::getStartLine)
                .thenComparing(Comparator.comparingInt(SourceMapEntry::getEndLine).reversed()));
        return code.toString();
    }

    private static int countLinesOfCode(String code) {
        int count = 0;
        for (String line : code.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                count++;
            }
        }
        return count;
    }
}
