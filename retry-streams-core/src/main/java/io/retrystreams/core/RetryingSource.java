package io.retrystreams.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * {@link ByteSource} that retries the read primitive on transient interruption.
 *
 * <p>{@code readFully}, {@code readToEnd} and {@code readToString} are forwarded once to the
 * wrapped source's own implementation and do not go through the retry loop.
 */
public class RetryingSource<S extends ByteSource> extends RetryingWrapper<S> implements ByteSource {

    RetryingSource(S inner, RetryPolicy policy) {
        super(inner, policy);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return retrier.callInt("read", () -> inner.read(b, off, len));
    }

    @Override
    public int read(byte[] b) throws IOException {
        return retrier.callInt("read", () -> inner.read(b));
    }

    @Override
    public void readFully(byte[] b, int off, int len) throws IOException {
        inner.readFully(b, off, len);
    }

    @Override
    public void readFully(byte[] b) throws IOException {
        inner.readFully(b);
    }

    @Override
    public long readToEnd(ByteArrayOutputStream out) throws IOException {
        return inner.readToEnd(out);
    }

    @Override
    public int readToString(StringBuilder out) throws IOException {
        return inner.readToString(out);
    }
}
