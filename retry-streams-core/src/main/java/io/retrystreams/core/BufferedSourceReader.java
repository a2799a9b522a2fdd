package io.retrystreams.core;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * {@link BufferedByteSource} over any {@link ByteSource}, with a fixed-capacity buffer.
 *
 * <p>A failed refill leaves the buffer empty and untouched, so the refill can simply be attempted
 * again. Reads of at least the buffer capacity into an empty buffer bypass it.
 *
 * <p>Not thread-safe.
 */
public final class BufferedSourceReader<S extends ByteSource> implements BufferedByteSource {

    public static final int DEFAULT_CAPACITY = 8192;

    private final S source;
    private final byte[] buffer;
    private int pos;
    private int limit;

    public BufferedSourceReader(S source) {
        this(source, DEFAULT_CAPACITY);
    }

    public BufferedSourceReader(S source, int capacity) {
        this.source = Objects.requireNonNull(source, "source");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.buffer = new byte[capacity];
    }

    @Override
    public ByteBuffer fillBuffer() throws IOException {
        if (pos >= limit) {
            int n = source.read(buffer, 0, buffer.length);
            pos = 0;
            limit = Math.max(n, 0);
        }
        return ByteBuffer.wrap(buffer, pos, limit - pos).slice().asReadOnlyBuffer();
    }

    @Override
    public void consume(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        pos = Math.min(pos + n, limit);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.requireNonNull(b, "b");
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (pos >= limit && len >= buffer.length) {
            return source.read(b, off, len);
        }
        ByteBuffer available = fillBuffer();
        if (!available.hasRemaining()) {
            return -1;
        }
        int n = Math.min(len, available.remaining());
        available.get(b, off, n);
        consume(n);
        return n;
    }

    /** Number of bytes buffered and not yet consumed. */
    public int buffered() {
        return limit - pos;
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * Returns the underlying source. Bytes still buffered are not returned to it and are lost.
     */
    public S unwrap() {
        return source;
    }

    @Override
    public void close() throws IOException {
        source.close();
    }

    @Override
    public String toString() {
        return "BufferedSourceReader[" + source + ", buffered=" + buffered() + "/" + buffer.length + "]";
    }
}
