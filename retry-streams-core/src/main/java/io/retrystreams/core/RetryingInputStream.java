package io.retrystreams.core;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link InputStream} that retries single reads on transient interruption.
 *
 * <p>{@code read()} and {@code read(byte[], int, int)} are retried. The bulk operations
 * ({@code readAllBytes}, {@code readNBytes}, {@code transferTo}) are forwarded once to the
 * wrapped stream, as are {@code skip}, {@code available}, {@code mark}, {@code reset} and
 * {@code close}.
 */
public final class RetryingInputStream extends FilterInputStream {

    private final Retrier retrier;

    RetryingInputStream(InputStream in, RetryPolicy policy) {
        super(Objects.requireNonNull(in, "in"));
        this.retrier = new Retrier(policy);
    }

    @Override
    public int read() throws IOException {
        return retrier.callInt("read", in::read);
    }

    @Override
    public int read(byte[] b) throws IOException {
        return read(b, 0, b.length);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return retrier.callInt("read", () -> in.read(b, off, len));
    }

    @Override
    public byte[] readAllBytes() throws IOException {
        return in.readAllBytes();
    }

    @Override
    public byte[] readNBytes(int len) throws IOException {
        return in.readNBytes(len);
    }

    @Override
    public int readNBytes(byte[] b, int off, int len) throws IOException {
        return in.readNBytes(b, off, len);
    }

    @Override
    public long transferTo(OutputStream out) throws IOException {
        return in.transferTo(out);
    }

    /**
     * Returns the wrapped stream, unchanged. This stream must not be used afterwards.
     */
    public InputStream unwrap() {
        return in;
    }

    public RetryPolicy policy() {
        return retrier.policy();
    }

    @Override
    public String toString() {
        return "RetryingInputStream[" + in + "]";
    }
}
