package io.retrystreams.testkit;

import io.retrystreams.core.ByteSink;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * {@link ByteSink} that shortens or fails writes to a wrapped sink according to a script.
 *
 * <p>Each primitive write consumes one {@link PartialOp}; {@code flush} consumes none. A failing
 * op throws without touching the wrapped sink.
 */
public final class PartialSink<K extends ByteSink> implements ByteSink {

    private final K inner;
    private final OpScript script;

    public PartialSink(K inner, List<PartialOp> ops) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.script = new OpScript(ops);
    }

    public static <K extends ByteSink> PartialSink<K> of(K inner, PartialOp... ops) {
        return new PartialSink<>(inner, List.of(ops));
    }

    @Override
    public int write(byte[] b, int off, int len) throws IOException {
        Objects.requireNonNull(b, "b");
        Objects.checkFromIndexSize(off, len, b.length);
        int allowed = script.allow(len);
        return inner.write(b, off, allowed);
    }

    @Override
    public void flush() throws IOException {
        inner.flush();
    }

    /** Number of primitive writes attempted, failed ones included. */
    public int attempts() {
        return script.attempts();
    }

    public int remainingOps() {
        return script.remaining();
    }

    public K unwrap() {
        return inner;
    }

    @Override
    public void close() throws IOException {
        inner.close();
    }

    @Override
    public String toString() {
        return "PartialSink[" + inner + ", attempts=" + attempts() + "]";
    }
}
