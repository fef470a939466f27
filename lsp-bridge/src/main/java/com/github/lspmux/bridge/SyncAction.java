package com.github.lspmux.bridge;

/**
 * What {@link DocumentSyncTracker#ensureSynced(String)} sent to the server.
 */
public enum SyncAction {
    /** First sync for the path: {@code textDocument/didOpen} at version 0. */
    OPENED,
    /** Content differed from the last sync: {@code textDocument/didChange} with the next version. */
    CHANGED,
    /** Content unchanged: nothing sent. */
    UNCHANGED
}
