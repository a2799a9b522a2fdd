package io.retrystreams.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Base for wrappers that own exactly one resource and retry its primitives on transient
 * interruption.
 *
 * <p>The wrapper keeps no state of its own besides the resource and the policy. Closing the
 * wrapper closes the resource; {@link #unwrap()} hands it back instead.
 *
 * @param <T> wrapped resource type
 */
public abstract class RetryingWrapper<T extends Closeable> implements Closeable {

    protected final T inner;
    final Retrier retrier;

    RetryingWrapper(T inner, RetryPolicy policy) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.retrier = new Retrier(policy);
    }

    /**
     * Returns the wrapped resource, unchanged. The wrapper must not be used afterwards.
     */
    public T unwrap() {
        return inner;
    }

    public RetryPolicy policy() {
        return retrier.policy();
    }

    @Override
    public void close() throws IOException {
        inner.close();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + inner + "]";
    }
}
