package com.github.lspmux.bridge.model;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

/**
 * A zero-based line and UTF-16 character offset, as on the wire.
 */
public record Position(int line, int character) {

    @NotNull
    public static Position fromJson(@NotNull JsonObject json) {
        return new Position(json.get("line").getAsInt(), json.get("character").getAsInt());
    }

    @NotNull
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("line", line);
        json.addProperty("character", character);
        return json;
    }

    /**
     * One-based {@code line:column} for display.
     */
    @NotNull
    public String toDisplayString() {
        return (line + 1) + ":" + (character + 1);
    }
}
