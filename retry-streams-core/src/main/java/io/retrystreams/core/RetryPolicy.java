package io.retrystreams.core;

/**
 * How many times a primitive is re-attempted after a transient interruption.
 *
 * <p>The default is {@link #unbounded()}: retry for as long as the resource keeps reporting
 * interruptions. A bound is opt-in; once it is spent, the last interruption is rethrown as-is.
 */
public final class RetryPolicy {

    private static final int UNBOUNDED = -1;
    private static final RetryPolicy UNBOUNDED_POLICY = new RetryPolicy(UNBOUNDED);

    private final int maxRetries;

    private RetryPolicy(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public static RetryPolicy unbounded() {
        return UNBOUNDED_POLICY;
    }

    /**
     * @param maxRetries retries allowed per primitive call, on top of the first attempt
     */
    public static RetryPolicy maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        return new RetryPolicy(maxRetries);
    }

    public boolean isBounded() {
        return maxRetries != UNBOUNDED;
    }

    /** Retry bound, or {@code -1} when unbounded. */
    public int maxRetries() {
        return maxRetries;
    }

    boolean allowsRetry(int retriesSoFar) {
        return maxRetries == UNBOUNDED || retriesSoFar < maxRetries;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof RetryPolicy)) return false;
        return maxRetries == ((RetryPolicy) other).maxRetries;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(maxRetries);
    }

    @Override
    public String toString() {
        return isBounded() ? "RetryPolicy[maxRetries=" + maxRetries + "]" : "RetryPolicy[unbounded]";
    }
}
