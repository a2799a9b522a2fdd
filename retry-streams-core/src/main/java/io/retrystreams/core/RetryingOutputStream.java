package io.retrystreams.core;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link OutputStream} that retries writes on transient interruption.
 *
 * <p>An {@link java.io.InterruptedIOException} reporting transferred bytes is not retried, since
 * writing the array again would duplicate output. {@code flush} and {@code close} are forwarded.
 */
public final class RetryingOutputStream extends FilterOutputStream {

    private final Retrier retrier;

    RetryingOutputStream(OutputStream out, RetryPolicy policy) {
        super(Objects.requireNonNull(out, "out"));
        this.retrier = new Retrier(policy);
    }

    @Override
    public void write(int b) throws IOException {
        retrier.call("write", () -> out.write(b));
    }

    @Override
    public void write(byte[] b) throws IOException {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        retrier.call("write", () -> out.write(b, off, len));
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }

    /**
     * Returns the wrapped stream, unchanged. This stream must not be used afterwards.
     */
    public OutputStream unwrap() {
        return out;
    }

    public RetryPolicy policy() {
        return retrier.policy();
    }

    @Override
    public String toString() {
        return "RetryingOutputStream[" + out + "]";
    }
}
