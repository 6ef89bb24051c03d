package com.urbanzen.analytics.pipeline;

import com.urbanzen.analytics.config.AnalyticsProperties;
import com.urbanzen.analytics.exception.TransientEmissionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Retries transient emission failures with multiplicative backoff, up to a
 * fixed number of attempts. Other failures propagate on the first attempt.
 */
@Slf4j
public class EmissionRetrier {

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public EmissionRetrier(int maxAttempts, Duration initialBackoff, double multiplier,
                           Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("backoff multiplier must be >= 1: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public static EmissionRetrier from(AnalyticsProperties.Pipeline pipeline) {
        return new EmissionRetrier(pipeline.getMaxAttempts(), pipeline.getInitialBackoff(),
                pipeline.getBackoffMultiplier(), pipeline.getMaxBackoff(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    /**
     * Runs {@code emission} until it succeeds or the attempts are exhausted.
     *
     * @return {@code true} if the emission succeeded, {@code false} if it was given up
     */
    public boolean run(String sink, Runnable emission) {
        long delayMs = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                emission.run();
                return true;
            } catch (TransientEmissionException e) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up on {} emission after {} attempts: {}", sink, attempt, e.getMessage());
                    return false;
                }
                log.warn("{} emission attempt {}/{} failed: {}; retrying in {} ms",
                        sink, attempt, maxAttempts, e.getMessage(), delayMs);
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off {} emission; dropping it", sink);
                    return false;
                }
                delayMs = Math.min((long) (delayMs * multiplier), maxBackoff.toMillis());
            }
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
