package io.retrystreams.testkit;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Queue of pending ops; unlimited once drained. */
final class OpScript {

    private final Deque<PartialOp> pending;
    private int attempts;

    OpScript(List<PartialOp> ops) {
        Objects.requireNonNull(ops, "ops");
        this.pending = new ArrayDeque<>(ops.size());
        for (PartialOp op : ops) {
            pending.add(Objects.requireNonNull(op, "op"));
        }
    }

    /**
     * Takes the next op and returns how many of {@code requested} bytes the call may transfer.
     *
     * @throws IOException if the op is a scripted failure
     */
    int allow(int requested) throws IOException {
        attempts++;
        PartialOp op = pending.poll();
        if (op == null || op instanceof PartialOp.Unlimited) {
            return requested;
        }
        if (op instanceof PartialOp.Limited limited) {
            return Math.min(requested, limited.max());
        }
        throw ((PartialOp.Fail) op).error().get();
    }

    int attempts() {
        return attempts;
    }

    int remaining() {
        return pending.size();
    }
}
