package io.legacyauth.core.model;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Inbound request body.
 *
 * <p>
 * Three shapes:
 * <ul>
 * <li>{@link Kind#EMPTY} — the request carried no body.</li>
 * <li>{@link Kind#STREAMING} — an unread stream from the client, consumable
 * exactly once. Passing it on untouched keeps large uploads out of memory.</li>
 * <li>{@link Kind#BUFFERED} — exact bytes already read, replayable any number
 * of times.</li>
 * </ul>
 *
 * <p>
 * A second attempt to consume a streaming body throws
 * {@link IllegalStateException}: once bytes are taken from the client they
 * must travel on in a reconstructed body, never be read again.
 */
public final class RequestBody {

    /** Body shape. */
    public enum Kind {
        EMPTY,
        STREAMING,
        BUFFERED
    }

    private static final RequestBody EMPTY = new RequestBody(Kind.EMPTY, null, new byte[0], 0);

    private final Kind kind;
    private final InputStream stream;
    private final byte[] content;
    private final long contentLength;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    private RequestBody(Kind kind, InputStream stream, byte[] content, long contentLength) {
        this.kind = kind;
        this.stream = stream;
        this.content = content;
        this.contentLength = contentLength;
    }

    /** Returns the empty body. */
    public static RequestBody empty() {
        return EMPTY;
    }

    /**
     * Wraps an unread client stream.
     *
     * @param stream        the stream, read at most once
     * @param contentLength declared length in bytes, or {@code -1} if unknown
     *                      (chunked)
     */
    public static RequestBody streaming(InputStream stream, long contentLength) {
        Objects.requireNonNull(stream, "stream must not be null");
        return new RequestBody(Kind.STREAMING, stream, null, contentLength);
    }

    /**
     * Wraps bytes already read from the client. The array is copied.
     *
     * @param content the exact bytes received
     */
    public static RequestBody buffered(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        byte[] copy = Arrays.copyOf(content, content.length);
        return new RequestBody(Kind.BUFFERED, null, copy, copy.length);
    }

    /**
     * Rebuilds a streaming body from a prefix that has already been read and
     * the unread remainder of the original stream. The result yields the
     * original bytes in their original order.
     *
     * @param prefix        bytes already taken from {@code remainder}'s source
     * @param remainder     the rest of the original stream
     * @param contentLength declared length of the whole body, or {@code -1}
     */
    public static RequestBody replay(byte[] prefix, InputStream remainder, long contentLength) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(remainder, "remainder must not be null");
        InputStream joined =
                new SequenceInputStream(new ByteArrayInputStream(Arrays.copyOf(prefix, prefix.length)), remainder);
        return new RequestBody(Kind.STREAMING, joined, null, contentLength);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public boolean isBuffered() {
        return kind == Kind.BUFFERED;
    }

    public boolean isStreaming() {
        return kind == Kind.STREAMING;
    }

    /** True once a streaming body has been handed out. Always false otherwise. */
    public boolean isConsumed() {
        return kind == Kind.STREAMING && consumed.get();
    }

    /**
     * Declared length in bytes: exact for empty and buffered bodies, the
     * client's {@code Content-Length} (or {@code -1}) for streaming bodies.
     */
    public long contentLength() {
        return contentLength;
    }

    /**
     * Returns a copy of the buffered bytes.
     *
     * @throws IllegalStateException if the body is streaming
     */
    public byte[] bytes() {
        if (kind == Kind.STREAMING) {
            throw new IllegalStateException("Streaming body has no buffered bytes");
        }
        return Arrays.copyOf(content, content.length);
    }

    /**
     * Opens the body for reading. Buffered and empty bodies return a fresh
     * stream each time; a streaming body returns its underlying stream once.
     *
     * @throws IllegalStateException if a streaming body was already consumed
     */
    public InputStream openStream() {
        if (kind != Kind.STREAMING) {
            return new ByteArrayInputStream(content);
        }
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Streaming body already consumed");
        }
        return stream;
    }

    /**
     * Reads the whole body into memory.
     *
     * @return the exact bytes
     * @throws IOException           if reading the client stream fails
     * @throws IllegalStateException if a streaming body was already consumed
     */
    public byte[] readAllBytes() throws IOException {
        if (kind != Kind.STREAMING) {
            return bytes();
        }
        return openStream().readAllBytes();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EMPTY -> "RequestBody[EMPTY]";
            case BUFFERED -> "RequestBody[BUFFERED, " + content.length + " bytes]";
            case STREAMING -> "RequestBody[STREAMING, length=" + contentLength + (isConsumed() ? ", consumed]" : "]");
        };
    }
}
