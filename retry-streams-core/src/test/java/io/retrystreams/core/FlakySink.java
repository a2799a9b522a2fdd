package io.retrystreams.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/** Throws the queued failures first, then accepts at most {@code maxPerWrite} bytes per write. */
final class FlakySink implements ByteSink {

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final Deque<IOException> failures;
    private final int maxPerWrite;
    int attempts;
    int flushes;
    boolean closed;

    FlakySink(IOException... failures) {
        this(Integer.MAX_VALUE, failures);
    }

    FlakySink(int maxPerWrite, IOException... failures) {
        this.maxPerWrite = maxPerWrite;
        this.failures = new ArrayDeque<>(Arrays.asList(failures));
    }

    @Override
    public int write(byte[] b, int off, int len) throws IOException {
        attempts++;
        IOException failure = failures.poll();
        if (failure != null) {
            throw failure;
        }
        int n = Math.min(len, maxPerWrite);
        written.write(b, off, n);
        return n;
    }

    @Override
    public void flush() {
        flushes++;
    }

    byte[] written() {
        return written.toByteArray();
    }

    @Override
    public void close() {
        closed = true;
    }
}
