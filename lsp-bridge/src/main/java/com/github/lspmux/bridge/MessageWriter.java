package com.github.lspmux.bridge;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes JSON-RPC messages with {@code Content-Length} framing.
 * Header and body of one message go out as a single write under a lock, so
 * frames from concurrent callers never interleave.
 */
public final class MessageWriter implements Closeable {
    static final String CONTENT_LENGTH = "Content-Length";
    static final Gson WIRE_GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final Object writeLock = new Object();
    private final OutputStream out;

    public MessageWriter(@NotNull OutputStream out) {
        this.out = out;
    }

    /**
     * Encode a message as {@code Content-Length: N\r\n\r\n<body>} where N is the UTF-8 byte length of the body.
     */
    @NotNull
    public static byte[] encode(@NotNull JsonElement message) {
        byte[] body = WIRE_GSON.toJson(message).getBytes(StandardCharsets.UTF_8);
        byte[] header = (CONTENT_LENGTH + ": " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] frame = new byte[header.length + body.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(body, 0, frame, header.length, body.length);
        return frame;
    }

    public void write(@NotNull JsonElement message) throws IOException {
        byte[] frame = encode(message);
        synchronized (writeLock) {
            out.write(frame);
            out.flush();
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            out.close();
        }
    }
}
