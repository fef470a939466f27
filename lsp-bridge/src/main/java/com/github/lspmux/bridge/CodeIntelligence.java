package com.github.lspmux.bridge;

import com.github.lspmux.bridge.model.Diagnostic;
import com.github.lspmux.bridge.model.Hover;
import com.github.lspmux.bridge.model.Location;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The read-only queries the tool layer issues against a language server.
 * Positions are zero-based, as on the wire. Callers sync the file before querying it.
 */
public interface CodeIntelligence {

    @NotNull
    SyncAction ensureSynced(@NotNull String path) throws LspException;

    @NotNull
    List<Diagnostic> diagnostics(@NotNull String path) throws LspException;

    /**
     * @return null when the server has no hover for the position
     */
    @Nullable
    Hover hover(@NotNull String path, int line, int character) throws LspException;

    /**
     * @return null when the server answered {@code null}; an empty list when it answered with no locations
     */
    @Nullable
    List<Location> definition(@NotNull String path, int line, int character) throws LspException;

    /**
     * @return null when the server answered {@code null}; an empty list when it answered with no locations
     */
    @Nullable
    List<Location> references(@NotNull String path, int line, int character) throws LspException;
}
