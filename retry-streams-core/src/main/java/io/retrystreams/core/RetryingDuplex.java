package io.retrystreams.core;

import java.io.IOException;

/**
 * Retrying wrapper for a resource that is both a {@link ByteSource} and a {@link ByteSink},
 * such as a socket-like channel. Both primitives are retried; composites are forwarded once.
 */
public final class RetryingDuplex<T extends ByteSource & ByteSink> extends RetryingSource<T> implements ByteSink {

    RetryingDuplex(T inner, RetryPolicy policy) {
        super(inner, policy);
    }

    @Override
    public int write(byte[] b, int off, int len) throws IOException {
        return retrier.callInt("write", () -> inner.write(b, off, len));
    }

    @Override
    public int write(byte[] b) throws IOException {
        return retrier.callInt("write", () -> inner.write(b));
    }

    @Override
    public void flush() throws IOException {
        inner.flush();
    }

    @Override
    public void writeAll(byte[] b, int off, int len) throws IOException {
        inner.writeAll(b, off, len);
    }

    @Override
    public void writeAll(byte[] b) throws IOException {
        inner.writeAll(b);
    }

    @Override
    public void writeFormatted(String format, Object... args) throws IOException {
        inner.writeFormatted(format, args);
    }
}
