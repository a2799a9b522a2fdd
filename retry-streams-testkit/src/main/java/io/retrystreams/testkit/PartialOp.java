package io.retrystreams.testkit;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One scripted outcome for a single primitive call on a {@link PartialSource} or {@link PartialSink}.
 */
public interface PartialOp {

    /** Transfers at most {@code max} bytes. {@code max} must be positive. */
    static PartialOp limited(int max) {
        return new Limited(max);
    }

    /** Transfers as many bytes as the wrapped resource does. */
    static PartialOp unlimited() {
        return Unlimited.INSTANCE;
    }

    /** Fails with a fresh {@link InterruptedIOException} reporting no transferred bytes. */
    static PartialOp interrupted() {
        return new Fail(() -> new InterruptedIOException("interrupted"));
    }

    /** Fails with the given exception. The same instance is thrown every time this op runs. */
    static PartialOp fail(IOException error) {
        Objects.requireNonNull(error, "error");
        return new Fail(() -> error);
    }

    record Limited(int max) implements PartialOp {
        public Limited {
            if (max <= 0) {
                throw new IllegalArgumentException("max must be > 0");
            }
        }
    }

    enum Unlimited implements PartialOp {
        INSTANCE
    }

    record Fail(Supplier<IOException> error) implements PartialOp {
        public Fail {
            Objects.requireNonNull(error, "error");
        }
    }
}
