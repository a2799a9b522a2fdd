package io.retrystreams.core;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

/**
 * Classifies I/O failures as transient interruptions.
 */
public final class Interruptions {

    private Interruptions() {}

    /**
     * Returns true if {@code e} reports an operation interrupted before it made progress.
     *
     * <p>That is an {@link InterruptedIOException} with no bytes transferred. A
     * {@link SocketTimeoutException} is a timeout and never counts.
     */
    public static boolean isTransient(IOException e) {
        if (!(e instanceof InterruptedIOException) || e instanceof SocketTimeoutException) {
            return false;
        }
        return ((InterruptedIOException) e).bytesTransferred == 0;
    }
}
