package com.github.dimitryivaniuta.canvas.http;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Outgoing request payload. Backed by a stream; when the stream supports mark/reset the body is
 * "seekable" and can be rewound so it may be read again (logging, retries).
 */
public final class RequestBody {

    private static final RequestBody EMPTY = of(new byte[0]);

    private final InputStream stream;
    private final boolean seekable;
    private final long length;

    private RequestBody(InputStream stream, long length) {
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.seekable = stream.markSupported();
        this.length = length;
        if (seekable) {
            stream.mark(Integer.MAX_VALUE);
        }
    }

    public static RequestBody empty() {
        return EMPTY;
    }

    public static RequestBody of(byte[] bytes) {
        return new RequestBody(new ByteArrayInputStream(bytes), bytes.length);
    }

    public static RequestBody of(String content) {
        return of(content.getBytes(StandardCharsets.UTF_8));
    }

    /** Length is unknown (-1) for arbitrary streams. */
    public static RequestBody ofStream(InputStream stream) {
        return new RequestBody(stream, -1);
    }

    public boolean isSeekable() {
        return seekable;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public long getLength() {
        return length;
    }

    public synchronized void rewind() {
        if (!seekable) return;
        try {
            stream.reset();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to rewind request body", e);
        }
    }

    /**
     * Drains the remaining bytes. Seekable bodies are rewound afterwards so the next reader starts at 0.
     */
    public synchronized byte[] readAllBytes() {
        try {
            byte[] bytes = stream.readAllBytes();
            rewind();
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read request body", e);
        }
    }

    /**
     * Content as UTF-8 text without consuming it. Empty for one-shot streams.
     */
    public Optional<String> peekAsString() {
        if (!seekable) return Optional.empty();
        return Optional.of(new String(readAllBytes(), StandardCharsets.UTF_8));
    }
}
