package io.retrystreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * The retry loop shared by every wrapper. Attempts a primitive until it returns or fails with
 * anything other than a transient interruption.
 */
final class Retrier {

    private static final Logger LOG = LoggerFactory.getLogger(Retrier.class);

    @FunctionalInterface
    interface IntCall {
        int call() throws IOException;
    }

    @FunctionalInterface
    interface VoidCall {
        void call() throws IOException;
    }

    private final RetryPolicy policy;

    Retrier(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    RetryPolicy policy() {
        return policy;
    }

    int callInt(String operation, IntCall call) throws IOException {
        int retries = 0;
        while (true) {
            try {
                return call.call();
            } catch (IOException e) {
                if (!Interruptions.isTransient(e) || !shouldRetry(operation, e, retries)) {
                    throw e;
                }
                retries++;
            }
        }
    }

    void call(String operation, VoidCall call) throws IOException {
        callInt(operation, () -> {
            call.call();
            return 0;
        });
    }

    private boolean shouldRetry(String operation, IOException e, int retries) {
        if (!policy.allowsRetry(retries)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Giving up on {} after {} retries: {}", operation, retries, e.toString());
            }
            return false;
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Retrying interrupted {} (retry {})", operation, retries + 1);
        }
        return true;
    }
}
