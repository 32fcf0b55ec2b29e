package cn.edu.zju.daily.policyflux.manager;

import java.time.Duration;

/** Deadline shared by all trainer replies of one round. */
class RoundDeadline {

    private final long deadlineNanos;
    private final boolean bounded;

    private RoundDeadline(Duration timeout) {
        this.bounded = timeout != null;
        this.deadlineNanos = bounded ? System.nanoTime() + timeout.toNanos() : 0;
    }

    static RoundDeadline start(Duration timeout) {
        return new RoundDeadline(timeout);
    }

    /** Time left, zero once passed, or null if the round is unbounded. */
    Duration remaining() {
        if (!bounded) {
            return null;
        }
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }
}
