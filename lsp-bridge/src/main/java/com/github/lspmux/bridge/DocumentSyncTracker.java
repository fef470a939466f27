package com.github.lspmux.bridge;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Keeps the server's view of files in step with their content on disk.
 * <p>
 * The first sync of a path sends {@code didOpen} at version 0. Later syncs compare a
 * fingerprint of the content and send a whole-document {@code didChange} with the next
 * version only when it differs. Syncs of the same path are serialized; different paths
 * proceed independently.
 */
public final class DocumentSyncTracker {
    private static final Logger LOG = Logger.getLogger(DocumentSyncTracker.class.getName());

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final class OpenDocument {
        boolean opened;
        int version;
        long fingerprint;
    }

    private final LspNotifier notifier;
    private final Map<String, OpenDocument> documents = new ConcurrentHashMap<>();

    public DocumentSyncTracker(@NotNull LspNotifier notifier) {
        this.notifier = notifier;
    }

    @NotNull
    public SyncAction ensureSynced(@NotNull String path) throws LspException {
        String uri;
        try {
            uri = FileUris.toUri(path);
        } catch (IllegalArgumentException e) {
            throw new LspException(e.getMessage(), e, false);
        }

        OpenDocument document = documents.computeIfAbsent(path, p -> new OpenDocument());
        synchronized (document) {
            String content = readContent(path);
            long fingerprint = fingerprint(content);

            if (!document.opened) {
                notifier.notify("textDocument/didOpen", didOpenParams(uri, LanguageIds.detect(path), content));
                document.opened = true;
                document.version = 0;
                document.fingerprint = fingerprint;
                LOG.fine(() -> "didOpen " + path);
                return SyncAction.OPENED;
            }

            if (document.fingerprint == fingerprint) {
                return SyncAction.UNCHANGED;
            }

            int next = document.version + 1;
            notifier.notify("textDocument/didChange", didChangeParams(uri, next, content));
            document.version = next;
            document.fingerprint = fingerprint;
            LOG.fine(() -> "didChange " + path + " v" + next);
            return SyncAction.CHANGED;
        }
    }

    /**
     * The last version sent for {@code path}, empty if it was never opened.
     */
    @NotNull
    public OptionalInt version(@NotNull String path) {
        OpenDocument document = documents.get(path);
        if (document == null) return OptionalInt.empty();
        synchronized (document) {
            return document.opened ? OptionalInt.of(document.version) : OptionalInt.empty();
        }
    }

    /**
     * 64-bit FNV-1a over the UTF-8 bytes. Change detection only.
     */
    static long fingerprint(@NotNull String content) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : content.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xFF;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static String readContent(String path) throws LspException {
        try {
            return Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new LspException("failed to read " + path + ": " + e.getMessage(), e, true);
        }
    }

    private static JsonObject didOpenParams(String uri, String languageId, String text) {
        JsonObject item = new JsonObject();
        item.addProperty("uri", uri);
        item.addProperty("languageId", languageId);
        item.addProperty("version", 0);
        item.addProperty("text", text);
        JsonObject params = new JsonObject();
        params.add("textDocument", item);
        return params;
    }

    private static JsonObject didChangeParams(String uri, int version, String text) {
        JsonObject identifier = new JsonObject();
        identifier.addProperty("uri", uri);
        identifier.addProperty("version", version);
        JsonObject change = new JsonObject();
        change.addProperty("text", text);
        JsonArray changes = new JsonArray();
        changes.add(change);
        JsonObject params = new JsonObject();
        params.add("textDocument", identifier);
        params.add("contentChanges", changes);
        return params;
    }
}
