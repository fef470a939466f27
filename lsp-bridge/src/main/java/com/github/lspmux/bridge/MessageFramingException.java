package com.github.lspmux.bridge;

import java.io.IOException;

/**
 * A frame on the input stream could not be decoded: bad header, oversized body or malformed JSON.
 */
public class MessageFramingException extends IOException {

    public MessageFramingException(String message) {
        super(message);
    }

    public MessageFramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
