package com.reviewengine.core.syntax;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewengine.core.executor.ExternalToolRunner;
import com.reviewengine.core.executor.ToolExecutionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PythonParser - parses source with the Python interpreter's own {@code ast}
 * module and rebuilds the result as a {@link SyntaxTree}.
 *
 * The bundled helper ({@code python/ast_dump.py}) is copied to a temporary
 * file once, then run as {@code python3 <helper> <source file>} through
 * {@link ExternalToolRunner}. It prints one marker-prefixed JSON line: either
 * the nodes in {@code ast.walk} order, a syntax error with CPython's message
 * and line, or a fatal interpreter failure.
 *
 * Nodes arrive flat with child indexes, always greater than the parent's,
 * so the tree is assembled from the last node back to the root without
 * recursion.
 */
@Component
public class PythonParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(PythonParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_INTERPRETER = "python3";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    static final String HELPER_RESOURCE = "python/ast_dump.py";
    static final String RESULT_MARKER = "@@REVIEW-AST@@";

    private final ExternalToolRunner runner;
    private final List<String> command;
    private final int timeoutSeconds;

    @Autowired
    public PythonParser(
            ExternalToolRunner runner,
            @Value("${code-review.parser.python:python3}") String pythonInterpreter,
            @Value("${code-review.parser.timeout-seconds:30}") int timeoutSeconds
    ) {
        this.runner = runner;
        List<String> full = new ArrayList<>(ExternalToolRunner.splitCommand(pythonInterpreter));
        if (full.isEmpty()) {
            full.add(DEFAULT_INTERPRETER);
        }
        full.add(extractHelper().toString());
        this.command = List.copyOf(full);
        this.timeoutSeconds = timeoutSeconds;
    }

    public PythonParser() {
        this(new ExternalToolRunner(), DEFAULT_INTERPRETER, DEFAULT_TIMEOUT_SECONDS);
    }

    @Override
    public SyntaxTree parse(String source) throws ParseException {
        ToolExecutionResult result = runner.runOnTempFile(source, command, timeoutSeconds);

        switch (result.getStatus()) {
            case NOT_FOUND:
                throw new ParserFailureException("Python interpreter not available: " + result.getErrorMessage());
            case TIMED_OUT:
            case FAILED:
                throw new ParserFailureException("Python parser failed: " + result.getErrorMessage());
            default:
                break;
        }

        JsonNode root = readResult(result);

        if (root.has("fatal")) {
            log.warn("[PythonParser] Interpreter gave up: {}", root.get("fatal").asText());
            throw new ParserFailureException(root.get("fatal").asText());
        }
        if (root.has("error")) {
            throw new ParseException(root.path("line").asInt(1), root.get("error").asText());
        }

        SyntaxNode module = buildTree(root.path("nodes"));
        return new SyntaxTree(module, lineCount(source));
    }

    private JsonNode readResult(ToolExecutionResult result) {
        String payload = null;
        for (String line : result.getOutput().split("\n")) {
            if (line.startsWith(RESULT_MARKER)) {
                payload = line.substring(RESULT_MARKER.length());
            }
        }
        if (payload == null) {
            String firstLine = result.getOutput().strip().lines().findFirst().orElse("no output");
            log.error("[PythonParser] No result line, exit code {}: {}", result.getExitCode(), firstLine);
            throw new ParserFailureException("Python parser produced no result (exit code "
                    + result.getExitCode() + "): " + firstLine);
        }
        try {
            return MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ParserFailureException("Unreadable parser output: " + e.getOriginalMessage(), e);
        }
    }

    static SyntaxNode buildTree(JsonNode nodes) {
        if (!nodes.isArray() || nodes.size() == 0) {
            throw new ParserFailureException("Parser output has no nodes");
        }
        SyntaxNode[] built = new SyntaxNode[nodes.size()];
        for (int i = nodes.size() - 1; i >= 0; i--) {
            JsonNode entry = nodes.get(i);
            SyntaxNode.Builder builder = SyntaxNode.builder(
                    NodeKind.fromAstName(entry.path("kind").asText()),
                    entry.path("line").asInt(1));

            if (entry.hasNonNull("id")) {
                builder.identifier(entry.get("id").asText());
            }
            if (entry.hasNonNull("as")) {
                builder.asName(entry.get("as").asText());
            }
            if (entry.hasNonNull("ctx")) {
                builder.context(ExprContext.valueOf(entry.get("ctx").asText()));
            }

            List<String> names = new ArrayList<>();
            for (JsonNode name : entry.path("names")) {
                names.add(name.asText());
            }
            builder.names(names);

            for (JsonNode field : entry.path("fields")) {
                String fieldName = field.get(0).asText();
                List<SyntaxNode> children = new ArrayList<>();
                for (JsonNode childIndex : field.get(1)) {
                    int child = childIndex.asInt();
                    if (child <= i || child >= built.length) {
                        throw new ParserFailureException("Malformed parser output at node " + i);
                    }
                    children.add(built[child]);
                }
                builder.children(fieldName, children);
            }
            built[i] = builder.build();
        }
        return built[0];
    }

    private static int lineCount(String source) {
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static Path extractHelper() {
        ClassLoader loader = PythonParser.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(HELPER_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Parser helper resource not found: " + HELPER_RESOURCE);
            }
            Path helper = Files.createTempFile("review_ast_", ".py");
            Files.write(helper, in.readAllBytes());
            helper.toFile().deleteOnExit();
            log.info("[PythonParser] Helper extracted to {}", helper);
            return helper;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to extract parser helper", e);
        }
    }
}
