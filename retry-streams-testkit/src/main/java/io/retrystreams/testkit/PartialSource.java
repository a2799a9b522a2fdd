package io.retrystreams.testkit;

import io.retrystreams.core.ByteSource;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * {@link ByteSource} that shortens or fails reads of a wrapped source according to a script.
 *
 * <p>Each primitive read consumes one {@link PartialOp}. A failing op throws without touching the
 * wrapped source. Once the script runs out, reads pass through unchanged.
 *
 * <pre>{@code
 * PartialSource<?> source = PartialSource.of(ByteSources.of(new ByteArrayInputStream(data)),
 *         PartialOp.interrupted(), PartialOp.limited(2));
 * }</pre>
 */
public final class PartialSource<S extends ByteSource> implements ByteSource {

    private final S inner;
    private final OpScript script;

    public PartialSource(S inner, List<PartialOp> ops) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.script = new OpScript(ops);
    }

    public static <S extends ByteSource> PartialSource<S> of(S inner, PartialOp... ops) {
        return new PartialSource<>(inner, List.of(ops));
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.requireNonNull(b, "b");
        Objects.checkFromIndexSize(off, len, b.length);
        int allowed = script.allow(len);
        return inner.read(b, off, allowed);
    }

    /** Number of primitive reads attempted, failed ones included. */
    public int attempts() {
        return script.attempts();
    }

    /** Number of scripted ops not yet consumed. */
    public int remainingOps() {
        return script.remaining();
    }

    public S unwrap() {
        return inner;
    }

    @Override
    public void close() throws IOException {
        inner.close();
    }

    @Override
    public String toString() {
        return "PartialSource[" + inner + ", attempts=" + attempts() + "]";
    }
}
