package io.retrystreams.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@link BufferedByteSource} that retries the refill on transient interruption.
 *
 * <p>Once a refill attempt completes, the wrapped source is asked for its buffer once more and
 * that view is returned. {@code consume} does no I/O and is forwarded as-is; {@code readUntil}
 * and {@code readLine} are forwarded once.
 */
public class RetryingBufferedSource<B extends BufferedByteSource> extends RetryingSource<B>
        implements BufferedByteSource {

    RetryingBufferedSource(B inner, RetryPolicy policy) {
        super(inner, policy);
    }

    @Override
    public ByteBuffer fillBuffer() throws IOException {
        retrier.call("fillBuffer", inner::fillBuffer);
        return inner.fillBuffer();
    }

    @Override
    public void consume(int n) {
        inner.consume(n);
    }

    @Override
    public long readUntil(byte delimiter, ByteArrayOutputStream out) throws IOException {
        return inner.readUntil(delimiter, out);
    }

    @Override
    public int readLine(StringBuilder out) throws IOException {
        return inner.readLine(out);
    }
}
