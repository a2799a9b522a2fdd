package io.retrystreams.core;

import java.io.IOException;

/**
 * {@link ByteSink} that retries the write primitive on transient interruption.
 *
 * <p>{@code flush}, {@code writeAll} and {@code writeFormatted} are forwarded once to the wrapped
 * sink's own implementation.
 */
public final class RetryingSink<K extends ByteSink> extends RetryingWrapper<K> implements ByteSink {

    RetryingSink(K inner, RetryPolicy policy) {
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
