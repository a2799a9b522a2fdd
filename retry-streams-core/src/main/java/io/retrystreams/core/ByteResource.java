package io.retrystreams.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Common parent of the capability interfaces. A resource implementing several capabilities
 * inherits a single {@link #close()}.
 */
public interface ByteResource extends Closeable {

    /** Releases the resource. Does nothing unless overridden. */
    @Override
    default void close() throws IOException {
    }
}
