package com.github.lspmux.bridge;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Map;

/**
 * Maps file extensions to LSP {@code languageId} values.
 */
public final class LanguageIds {
    public static final String PLAINTEXT = "plaintext";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry("rs", "rust"), Map.entry("toml", "toml"), Map.entry("json", "json"),
        Map.entry("yaml", "yaml"), Map.entry("yml", "yaml"),
        Map.entry("md", "markdown"), Map.entry("markdown", "markdown"),
        Map.entry("py", "python"), Map.entry("js", "javascript"), Map.entry("ts", "typescript"),
        Map.entry("jsx", "javascriptreact"), Map.entry("tsx", "typescriptreact"),
        Map.entry("c", "c"), Map.entry("cpp", "cpp"), Map.entry("cc", "cpp"), Map.entry("cxx", "cpp"),
        Map.entry("h", "cpp"), Map.entry("hpp", "cpp"),
        Map.entry("go", "go"), Map.entry("rb", "ruby"),
        Map.entry("sh", "shellscript"), Map.entry("bash", "shellscript"), Map.entry("zsh", "shellscript"),
        Map.entry("css", "css"), Map.entry("html", "html"), Map.entry("htm", "html"),
        Map.entry("xml", "xml"), Map.entry("sql", "sql"), Map.entry("nix", "nix")
    );

    private LanguageIds() {}

    @NotNull
    public static String detect(@NotNull String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String fileName = path.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return PLAINTEXT;
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, PLAINTEXT);
    }
}
