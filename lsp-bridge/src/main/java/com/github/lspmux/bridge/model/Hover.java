package com.github.lspmux.bridge.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Hover result with its contents flattened to text.
 */
public record Hover(@NotNull String contents, @Nullable Range range) {

    @NotNull
    public static Hover fromJson(@NotNull JsonObject json) {
        Range range = json.has("range") && json.get("range").isJsonObject()
            ? Range.fromJson(json.getAsJsonObject("range"))
            : null;
        return new Hover(renderContents(json.get("contents")), range);
    }

    /**
     * Render {@code MarkupContent}, a {@code MarkedString} or an array of them.
     * Language-tagged strings become fenced code blocks; array items are separated by a blank line.
     */
    @NotNull
    static String renderContents(@Nullable JsonElement contents) {
        if (contents == null || contents.isJsonNull()) return "";
        if (contents.isJsonArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonElement item : contents.getAsJsonArray()) {
                parts.add(renderContents(item));
            }
            return String.join("\n\n", parts);
        }
        if (contents.isJsonPrimitive()) {
            return contents.getAsString();
        }
        JsonObject object = contents.getAsJsonObject();
        String value = object.has("value") ? object.get("value").getAsString() : "";
        if (object.has("language")) {
            return "```" + object.get("language").getAsString() + "\n" + value + "\n```";
        }
        return value;
    }
}
