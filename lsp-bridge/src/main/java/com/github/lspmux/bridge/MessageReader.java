package com.github.lspmux.bridge;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads {@code Content-Length} framed JSON-RPC messages from a byte stream.
 * Not thread-safe: a single reader owns the stream.
 */
public final class MessageReader implements Closeable {
    private static final int MAX_HEADER_LINE = 8 * 1024;

    private final InputStream in;
    private final long maxMessageSize;

    public MessageReader(@NotNull InputStream in, long maxMessageSize) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * Read and parse the next message.
     *
     * @return the parsed JSON value, or {@code null} when the stream ended cleanly between messages
     */
    @Nullable
    public JsonElement read() throws IOException {
        byte[] body = readFrame();
        if (body == null) return null;
        try {
            return JsonParser.parseString(new String(body, StandardCharsets.UTF_8));
        } catch (JsonParseException e) {
            throw new MessageFramingException("invalid JSON-RPC message", e);
        }
    }

    /**
     * Read the next frame and return its raw body bytes.
     *
     * @return the body, or {@code null} when the stream ended cleanly between messages
     */
    @Nullable
    public byte[] readFrame() throws IOException {
        long contentLength = -1;
        boolean sawHeaderBytes = false;
        while (true) {
            String line = readHeaderLine(sawHeaderBytes);
            if (line == null) return null;
            sawHeaderBytes = true;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) break;
            int colon = trimmed.indexOf(':');
            if (colon > 0 && trimmed.substring(0, colon).trim().equalsIgnoreCase(MessageWriter.CONTENT_LENGTH)) {
                contentLength = parseContentLength(trimmed.substring(colon + 1).trim());
            }
        }

        if (contentLength < 0) {
            throw new MessageFramingException("missing Content-Length header");
        }
        if (contentLength > maxMessageSize) {
            throw new MessageFramingException(
                "LSP message size " + contentLength + " exceeds maximum of " + maxMessageSize);
        }

        byte[] body = in.readNBytes((int) contentLength);
        if (body.length < contentLength) {
            throw new EOFException("stream ended after " + body.length + " of " + contentLength + " body bytes");
        }
        return body;
    }

    private static long parseContentLength(String value) throws MessageFramingException {
        try {
            long length = Long.parseLong(value);
            if (length < 0) throw new MessageFramingException("invalid Content-Length: " + value);
            return length;
        } catch (NumberFormatException e) {
            throw new MessageFramingException("invalid Content-Length: " + value, e);
        }
    }

    /**
     * Read one header line without its terminator.
     * Returns null on end of stream before the first byte of a message.
     */
    @Nullable
    private String readHeaderLine(boolean insideHeader) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(64);
        while (true) {
            int b = in.read();
            if (b < 0) {
                if (!insideHeader && line.size() == 0) return null;
                throw new EOFException("stream ended inside message header");
            }
            if (b == '\n') break;
            if (line.size() >= MAX_HEADER_LINE) {
                throw new MessageFramingException("header line exceeds " + MAX_HEADER_LINE + " bytes");
            }
            line.write(b);
        }
        String text = line.toString(StandardCharsets.US_ASCII);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
