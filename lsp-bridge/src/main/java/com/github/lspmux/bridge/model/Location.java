package com.github.lspmux.bridge.model;

import com.github.lspmux.bridge.FileUris;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

/**
 * A document URI plus a range within that document.
 */
public record Location(@NotNull String uri, @NotNull Range range) {

    /**
     * Parse either a {@code Location} or a {@code LocationLink}; a link resolves to its
     * target URI and target selection range.
     */
    @NotNull
    public static Location fromJson(@NotNull JsonObject json) {
        if (json.has("targetUri")) {
            String rangeKey = json.has("targetSelectionRange") ? "targetSelectionRange" : "targetRange";
            return new Location(json.get("targetUri").getAsString(), Range.fromJson(json.getAsJsonObject(rangeKey)));
        }
        return new Location(json.get("uri").getAsString(), Range.fromJson(json.getAsJsonObject("range")));
    }

    /**
     * {@code path:line:col}, one-based.
     */
    @NotNull
    public String toDisplayString() {
        return FileUris.toPath(uri) + ":" + range.start().toDisplayString();
    }
}
