package com.codearena.core.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A fixed point in time by which an execution must finish.
 *
 * <p>A deadline is handed to every blocking call that spawns or awaits an
 * execution environment. The call that observes expiry is the one that
 * terminates the environment.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;
    private final Duration budget;

    private Deadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.budget = budget.isNegative() ? Duration.ZERO : budget;
        this.expiresAt = clock.instant().plus(this.budget);
    }

    public static Deadline after(Duration budget) {
        return new Deadline(Clock.systemUTC(), budget);
    }

    public static Deadline afterMillis(long millis) {
        return after(Duration.ofMillis(millis));
    }

    static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock, budget);
    }

    /** The total budget this deadline was created with. */
    public Duration budget() {
        return budget;
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Remaining time in whole milliseconds, rounded up so that a wait of this
     * length always reaches the deadline.
     */
    public long remainingMillis() {
        long nanos = remaining().toNanos();
        return (nanos + 999_999) / 1_000_000;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Carves a sub-deadline that ends no later than this one.
     *
     * @param cap upper bound for the sub-deadline's budget
     */
    public Deadline limitedTo(Duration cap) {
        Duration left = remaining();
        return new Deadline(clock, cap.compareTo(left) < 0 ? cap : left);
    }

    @Override
    public String toString() {
        return "Deadline[budget=" + budget.toMillis() + "ms, remaining=" + remainingMillis() + "ms]";
    }
}
