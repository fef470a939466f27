package com.github.lspmux.bridge.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public record Diagnostic(@NotNull Range range, @NotNull Severity severity, @NotNull String message,
                         @Nullable String source, @Nullable String code) {

    public enum Severity {
        ERROR,
        WARNING,
        INFO,
        HINT,
        UNKNOWN;

        /**
         * LSP encodes severity as 1 (error) through 4 (hint); absent or anything else is unknown.
         */
        @NotNull
        public static Severity fromLsp(@Nullable JsonElement value) {
            if (value == null || value.isJsonNull()) return UNKNOWN;
            return switch (value.getAsInt()) {
                case 1 -> ERROR;
                case 2 -> WARNING;
                case 3 -> INFO;
                case 4 -> HINT;
                default -> UNKNOWN;
            };
        }
    }

    @NotNull
    public static Diagnostic fromJson(@NotNull JsonObject json) {
        return new Diagnostic(
            Range.fromJson(json.getAsJsonObject("range")),
            Severity.fromLsp(json.get("severity")),
            json.has("message") ? json.get("message").getAsString() : "",
            optionalString(json, "source"),
            optionalString(json, "code"));
    }

    @Nullable
    private static String optionalString(JsonObject json, String key) {
        JsonElement value = json.get(key);
        return value == null || value.isJsonNull() ? null : value.getAsString();
    }

    /**
     * {@code line:col: [SEVERITY] message}, one-based.
     */
    @NotNull
    public String toDisplayString() {
        return range.start().toDisplayString() + ": [" + severity + "] " + message;
    }
}
