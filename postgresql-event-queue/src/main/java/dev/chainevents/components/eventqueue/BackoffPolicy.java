package dev.chainevents.components.eventqueue;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Delay policy used when retrying after a transient store failure or a lost notification subscription
 */
public class BackoffPolicy {
    public final Duration initialDelay;
    public final Duration followupDelay;
    public final double   followupDelayMultiplier;
    public final Duration maximumDelay;

    public BackoffPolicy(Duration initialDelay,
                         Duration followupDelay,
                         double followupDelayMultiplier,
                         Duration maximumDelay) {
        this.initialDelay = requireNonNull(initialDelay, "You must specify an initialDelay");
        this.followupDelay = requireNonNull(followupDelay, "You must specify a followupDelay");
        this.maximumDelay = requireNonNull(maximumDelay, "You must specify a maximumDelay");
        requireTrue(followupDelayMultiplier >= 1.0d, "followupDelayMultiplier must be >= 1.0");
        requireTrue(!initialDelay.isNegative() && !followupDelay.isNegative(), "Delays must not be negative");
        if (maximumDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(msg("maximumDelay {} must be larger than or equal to initialDelay {}", maximumDelay, initialDelay));
        }
        this.followupDelayMultiplier = followupDelayMultiplier;
    }

    /**
     * Calculate the delay to wait before the next attempt.<br>
     * The delay grows by <code>followupDelay * followupDelayMultiplier^n</code> for every consecutive failure
     * and is capped at {@link #maximumDelay}
     *
     * @param numberOfFailedAttempts the number of consecutive attempts that failed before this one (0 for the first retry)
     * @return the delay, never larger than {@link #maximumDelay}
     */
    public Duration calculateNextDelay(int numberOfFailedAttempts) {
        requireTrue(numberOfFailedAttempts >= 0, "numberOfFailedAttempts must be 0 or larger");
        double delayMillis = initialDelay.toMillis();
        double increment   = followupDelay.toMillis();
        for (int attempt = 0; attempt < numberOfFailedAttempts && delayMillis < maximumDelay.toMillis(); attempt++) {
            delayMillis += increment;
            increment *= followupDelayMultiplier;
        }
        if (delayMillis >= maximumDelay.toMillis()) {
            return maximumDelay;
        }
        return Duration.ofMillis((long) delayMillis);
    }

    public static BackoffPolicy fixedBackoff(Duration delay) {
        return new BackoffPolicy(delay, Duration.ZERO, 1.0d, delay);
    }

    public static BackoffPolicy linearBackoff(Duration delay, Duration maximumDelay) {
        return new BackoffPolicy(delay, delay, 1.0d, maximumDelay);
    }

    public static BackoffPolicy exponentialBackoff(Duration initialDelay,
                                                   Duration followupDelay,
                                                   double followupDelayMultiplier,
                                                   Duration maximumDelay) {
        return new BackoffPolicy(initialDelay, followupDelay, followupDelayMultiplier, maximumDelay);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{" +
                "initialDelay=" + initialDelay +
                ", followupDelay=" + followupDelay +
                ", followupDelayMultiplier=" + followupDelayMultiplier +
                ", maximumDelay=" + maximumDelay +
                '}';
    }
}
