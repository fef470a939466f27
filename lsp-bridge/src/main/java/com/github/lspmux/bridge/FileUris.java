package com.github.lspmux.bridge;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Conversion between absolute file paths and {@code file://} URIs.
 * Every byte other than ASCII letters, digits and {@code -_.~/} is percent-encoded with uppercase hex.
 */
public final class FileUris {
    private static final String FILE_SCHEME = "file://";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private FileUris() {}

    /**
     * @throws IllegalArgumentException if {@code path} is not absolute
     */
    @NotNull
    public static String toUri(@NotNull String path) {
        if (!isAbsolute(path)) {
            throw new IllegalArgumentException("invalid absolute file path for URI: " + path);
        }
        return FILE_SCHEME + percentEncode(path);
    }

    /**
     * Extract the file path from a {@code file://} URI. Undecodable input is returned as-is.
     */
    @NotNull
    public static String toPath(@NotNull String uri) {
        String path = uri.startsWith(FILE_SCHEME) ? uri.substring(FILE_SCHEME.length()) : uri;
        String decoded = percentDecode(path);
        return decoded != null ? decoded : path;
    }

    private static boolean isAbsolute(String path) {
        try {
            return Path.of(path).isAbsolute();
        } catch (InvalidPathException e) {
            return false;
        }
    }

    static String percentEncode(String path) {
        StringBuilder encoded = new StringBuilder(path.length());
        for (byte b : path.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                encoded.append((char) c);
            } else {
                encoded.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return encoded.toString();
    }

    @Nullable
    static String percentDecode(String path) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(path.length());
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '%') {
                if (i + 2 >= path.length()) return null;
                int hi = Character.digit(path.charAt(i + 1), 16);
                int lo = Character.digit(path.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) return null;
                bytes.write((hi << 4) | lo);
                i += 3;
            } else {
                int codePoint = path.codePointAt(i);
                byte[] raw = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
                bytes.write(raw, 0, raw.length);
                i += Character.charCount(codePoint);
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes.toByteArray()))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
            || c == '-' || c == '.' || c == '_' || c == '~' || c == '/';
    }
}
