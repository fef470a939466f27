package com.github.lspmux.mcp;

import com.github.lspmux.bridge.CodeIntelligence;
import com.github.lspmux.bridge.LspException;
import com.github.lspmux.bridge.model.Diagnostic;
import com.github.lspmux.bridge.model.Hover;
import com.github.lspmux.bridge.model.Location;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * The four read-only rust-analyzer tools.
 * Each validates its arguments, syncs the file with the server, issues one LSP request
 * and renders the answer as text with one-based positions.
 */
public class RustAnalyzerTools {
    private static final Logger LOG = Logger.getLogger(RustAnalyzerTools.class.getName());

    static final String DIAGNOSTICS = "rust_diagnostics";
    static final String HOVER = "rust_hover";
    static final String GOTO_DEFINITION = "rust_goto_definition";
    static final String FIND_REFERENCES = "rust_find_references";

    private static final String FILE_PATH = "file_path";
    private static final String LINE = "line";
    private static final String CHARACTER = "character";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final String FILE_PATH_DESCRIPTION = "Absolute path to the Rust source file.";
    private static final String LOADING_NOTE = "\n\nNote: rust-analyzer may still be loading. Try again in a few seconds.";

    private final CodeIntelligence lsp;

    public RustAnalyzerTools(@NotNull CodeIntelligence lsp) {
        this.lsp = lsp;
    }

    @NotNull
    JsonArray list() {
        Map<String, Map<String, String>> fileOnly = Map.of(
            FILE_PATH, Map.of(TYPE, "string", DESCRIPTION, FILE_PATH_DESCRIPTION));
        Map<String, Map<String, String>> position = Map.of(
            FILE_PATH, Map.of(TYPE, "string", DESCRIPTION, FILE_PATH_DESCRIPTION),
            LINE, Map.of(TYPE, "integer", DESCRIPTION, "Zero-based line number."),
            CHARACTER, Map.of(TYPE, "integer", DESCRIPTION, "Zero-based character offset."));
        List<String> positionRequired = List.of(FILE_PATH, LINE, CHARACTER);

        JsonArray tools = new JsonArray();
        tools.add(buildTool(DIAGNOSTICS,
            "Get Rust compiler errors and warnings for a file. Returns diagnostics with line numbers, severity, and messages.",
            fileOnly, List.of(FILE_PATH)));
        tools.add(buildTool(HOVER,
            "Get type information and documentation for the symbol at a position.",
            position, positionRequired));
        tools.add(buildTool(GOTO_DEFINITION,
            "Find where a symbol is defined. Returns the file path and line number of the definition.",
            position, positionRequired));
        tools.add(buildTool(FIND_REFERENCES,
            "Find all references to a symbol at a specific position. Returns a list of file paths and line numbers.",
            position, positionRequired));
        return tools;
    }

    private static JsonObject buildTool(String name, String description, Map<String, Map<String, String>> properties,
                                        List<String> required) {
        JsonObject tool = new JsonObject();
        tool.addProperty("name", name);
        tool.addProperty(DESCRIPTION, description);
        JsonObject inputSchema = new JsonObject();
        inputSchema.addProperty(TYPE, "object");
        JsonObject props = new JsonObject();
        for (var entry : properties.entrySet()) {
            JsonObject prop = new JsonObject();
            entry.getValue().forEach(prop::addProperty);
            if ("integer".equals(entry.getValue().get(TYPE))) {
                prop.addProperty("minimum", 0);
            }
            props.add(entry.getKey(), prop);
        }
        inputSchema.add("properties", props);
        JsonArray req = new JsonArray();
        required.forEach(req::add);
        inputSchema.add("required", req);
        tool.add("inputSchema", inputSchema);
        return tool;
    }

    /**
     * Run a tool.
     *
     * @return an MCP {@code CallToolResult}; LSP failures come back as results with {@code isError}
     * @throws InvalidParamsException for an unknown tool or bad arguments
     */
    @NotNull
    JsonObject call(@NotNull String toolName, @NotNull JsonObject arguments) throws InvalidParamsException {
        LOG.fine(() -> "MCP: tool call " + toolName + " " + arguments);
        return switch (toolName) {
            case DIAGNOSTICS -> diagnostics(arguments);
            case HOVER -> hover(arguments);
            case GOTO_DEFINITION -> gotoDefinition(arguments);
            case FIND_REFERENCES -> findReferences(arguments);
            default -> throw new InvalidParamsException("Unknown tool: " + toolName);
        };
    }

    private JsonObject diagnostics(JsonObject arguments) throws InvalidParamsException {
        String path = filePath(arguments);
        JsonObject openFailure = sync(path);
        if (openFailure != null) return openFailure;

        try {
            List<Diagnostic> items = lsp.diagnostics(path);
            if (items.isEmpty()) return text("No diagnostics found.");
            return text(items.stream().map(Diagnostic::toDisplayString).collect(Collectors.joining("\n")));
        } catch (LspException e) {
            return failure(DIAGNOSTICS, "Diagnostics request failed: " + e.getMessage() + LOADING_NOTE);
        }
    }

    private JsonObject hover(JsonObject arguments) throws InvalidParamsException {
        String path = filePath(arguments);
        int line = position(arguments, LINE);
        int character = position(arguments, CHARACTER);
        JsonObject openFailure = sync(path);
        if (openFailure != null) return openFailure;

        try {
            Hover hover = lsp.hover(path, line, character);
            if (hover == null) return text("No hover information available at this position.");
            return text(hover.contents());
        } catch (LspException e) {
            return failure(HOVER, "Hover request failed: " + e.getMessage());
        }
    }

    private JsonObject gotoDefinition(JsonObject arguments) throws InvalidParamsException {
        String path = filePath(arguments);
        int line = position(arguments, LINE);
        int character = position(arguments, CHARACTER);
        JsonObject openFailure = sync(path);
        if (openFailure != null) return openFailure;

        try {
            List<Location> locations = lsp.definition(path, line, character);
            if (locations == null) return text("No definition found at this position.");
            if (locations.isEmpty()) return text("No definition found.");
            return text(formatLocations(locations));
        } catch (LspException e) {
            return failure(GOTO_DEFINITION, "Go to definition failed: " + e.getMessage());
        }
    }

    private JsonObject findReferences(JsonObject arguments) throws InvalidParamsException {
        String path = filePath(arguments);
        int line = position(arguments, LINE);
        int character = position(arguments, CHARACTER);
        JsonObject openFailure = sync(path);
        if (openFailure != null) return openFailure;

        try {
            List<Location> locations = lsp.references(path, line, character);
            if (locations == null) return text("No references found at this position.");
            if (locations.isEmpty()) return text("No references found.");
            return text("Found " + locations.size() + " reference(s):\n" + formatLocations(locations));
        } catch (LspException e) {
            return failure(FIND_REFERENCES, "Find references failed: " + e.getMessage());
        }
    }

    @Nullable
    private JsonObject sync(String path) {
        try {
            lsp.ensureSynced(path);
            return null;
        } catch (LspException e) {
            return failure("sync", "Failed to open file: " + e.getMessage());
        }
    }

    private static String formatLocations(List<Location> locations) {
        return locations.stream().map(Location::toDisplayString).collect(Collectors.joining("\n"));
    }

    // ---- argument validation ----

    static String filePath(JsonObject arguments) throws InvalidParamsException {
        JsonElement value = arguments.get(FILE_PATH);
        if (!(value instanceof JsonPrimitive primitive) || !primitive.isString()) {
            throw new InvalidParamsException("missing required argument: " + FILE_PATH);
        }
        String path = primitive.getAsString();
        Path p;
        try {
            p = Path.of(path);
        } catch (InvalidPathException e) {
            throw new InvalidParamsException("file_path must be absolute, got: " + path);
        }
        if (!p.isAbsolute()) {
            throw new InvalidParamsException("file_path must be absolute, got: " + path);
        }
        if (!Files.exists(p)) {
            throw new InvalidParamsException("file not found: " + path);
        }
        return path;
    }

    static int position(JsonObject arguments, String name) throws InvalidParamsException {
        JsonElement value = arguments.get(name);
        if (!(value instanceof JsonPrimitive primitive) || !primitive.isNumber()) {
            throw new InvalidParamsException("missing required argument: " + name);
        }
        int n;
        try {
            n = primitive.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidParamsException(notNonNegative(name, primitive));
        }
        if (n < 0) {
            throw new InvalidParamsException(notNonNegative(name, primitive));
        }
        return n;
    }

    private static String notNonNegative(String name, JsonPrimitive value) {
        return name + " must be a non-negative integer, got: " + value.getAsString();
    }

    // ---- results ----

    static JsonObject text(String text) {
        JsonObject result = new JsonObject();
        JsonArray content = new JsonArray();
        JsonObject textContent = new JsonObject();
        textContent.addProperty("type", "text");
        textContent.addProperty("text", text);
        content.add(textContent);
        result.add("content", content);
        return result;
    }

    private static JsonObject failure(String toolName, String message) {
        LOG.warning(() -> "MCP: " + toolName + " failed: " + message);
        JsonObject result = text(message);
        result.addProperty("isError", true);
        return result;
    }
}
