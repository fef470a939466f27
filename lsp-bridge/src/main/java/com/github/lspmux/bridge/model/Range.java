package com.github.lspmux.bridge.model;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

public record Range(@NotNull Position start, @NotNull Position end) {

    @NotNull
    public static Range fromJson(@NotNull JsonObject json) {
        return new Range(Position.fromJson(json.getAsJsonObject("start")),
            Position.fromJson(json.getAsJsonObject("end")));
    }
}
