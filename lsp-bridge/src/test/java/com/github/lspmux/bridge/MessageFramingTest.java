package com.github.lspmux.bridge;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageFramingTest {

    private static final long MAX = 100L * 1024 * 1024;

    private static MessageReader readerOf(String raw) {
        return new MessageReader(new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8)), MAX);
    }

    @Nested
    class Encoding {

        @Test
        void testHeaderCarriesUtf8ByteLength() {
            JsonObject msg = new JsonObject();
            msg.addProperty("text", "héllo");
            String frame = new String(MessageWriter.encode(msg), StandardCharsets.UTF_8);

            String body = "{\"text\":\"héllo\"}";
            int bytes = body.getBytes(StandardCharsets.UTF_8).length;
            assertEquals(17, bytes);
            assertEquals("Content-Length: 17\r\n\r\n" + body, frame);
        }

        @Test
        void testHtmlCharactersAreNotEscaped() {
            JsonObject msg = new JsonObject();
            msg.addProperty("text", "Vec<T> & 'a");
            String frame = new String(MessageWriter.encode(msg), StandardCharsets.UTF_8);
            assertTrue(frame.endsWith("{\"text\":\"Vec<T> & 'a\"}"), frame);
        }

        @Test
        void testWriterRoundTripsThroughReader() throws IOException {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            MessageWriter writer = new MessageWriter(sink);
            JsonElement first = JsonParser.parseString("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[1,2,{\"a\":null}]}");
            JsonElement second = JsonParser.parseString("{\"jsonrpc\":\"2.0\",\"method\":\"x\",\"params\":\"ünïcødé 🦀\"}");
            writer.write(first);
            writer.write(second);

            MessageReader reader = new MessageReader(new ByteArrayInputStream(sink.toByteArray()), MAX);
            assertEquals(first, reader.read());
            assertEquals(second, reader.read());
            assertNull(reader.read(), "clean EOF between messages");
        }
    }

    @Nested
    class Headers {

        @Test
        void testExtraHeadersIgnoredAndNameCaseInsensitive() throws IOException {
            MessageReader reader = readerOf(
                "content-length: 2\r\nContent-Type: application/vscode-jsonrpc; charset=utf-8\r\n\r\n{}");
            assertEquals(new JsonObject(), reader.read());
        }

        @Test
        void testMissingContentLength() {
            MessageReader reader = readerOf("Content-Type: x\r\n\r\n{}");
            MessageFramingException e = assertThrows(MessageFramingException.class, reader::read);
            assertEquals("missing Content-Length header", e.getMessage());
        }

        @Test
        void testUnparsableContentLength() {
            MessageReader reader = readerOf("Content-Length: abc\r\n\r\n{}");
            MessageFramingException e = assertThrows(MessageFramingException.class, reader::read);
            assertEquals("invalid Content-Length: abc", e.getMessage());
        }

        @Test
        void testNegativeContentLength() {
            MessageReader reader = readerOf("Content-Length: -5\r\n\r\n{}");
            assertThrows(MessageFramingException.class, reader::read);
        }

        @Test
        void testOverlongHeaderLine() {
            MessageReader reader = readerOf("X-Junk: " + "a".repeat(9000) + "\r\n\r\n{}");
            assertThrows(MessageFramingException.class, reader::read);
        }

        @Test
        void testEndOfStreamInsideHeader() {
            MessageReader reader = readerOf("Content-Length: 2\r\n");
            assertThrows(EOFException.class, reader::read);
        }
    }

    @Nested
    class Bodies {

        @Test
        void testTruncatedBody() {
            MessageReader reader = readerOf("Content-Length: 10\r\n\r\n{}");
            assertThrows(EOFException.class, reader::read);
        }

        @Test
        void testMalformedJson() {
            MessageReader reader = readerOf("Content-Length: 5\r\n\r\n{oops");
            MessageFramingException e = assertThrows(MessageFramingException.class, reader::read);
            assertEquals("invalid JSON-RPC message", e.getMessage());
        }

        @Test
        void testOversizedMessageRejectedBeforeBodyIsRead() {
            byte[] header = "Content-Length: 1000\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
            InputStream headerOnly = new InputStream() {
                private int pos;

                @Override
                public int read() {
                    if (pos >= header.length) throw new IllegalStateException("body must not be read");
                    return header[pos++];
                }

                @Override
                public int read(byte[] b, int off, int len) {
                    if (pos >= header.length) throw new IllegalStateException("body must not be read");
                    int n = Math.min(len, header.length - pos);
                    System.arraycopy(header, pos, b, off, n);
                    pos += n;
                    return n;
                }
            };
            MessageReader reader = new MessageReader(headerOnly, 999);

            MessageFramingException e = assertThrows(MessageFramingException.class, reader::readFrame);
            assertEquals("LSP message size 1000 exceeds maximum of 999", e.getMessage());
        }

        @Test
        void testMessageAtExactlyTheLimitIsAccepted() throws IOException {
            MessageReader reader = new MessageReader(
                new ByteArrayInputStream("Content-Length: 2\r\n\r\n{}".getBytes(StandardCharsets.US_ASCII)), 2);
            assertArrayEquals("{}".getBytes(StandardCharsets.US_ASCII), reader.readFrame());
        }
    }
}
