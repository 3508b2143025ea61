package com.gentoro.fedquery.engine;

import com.gentoro.fedquery.config.EngineSettings;
import com.gentoro.fedquery.source.AdapterException;
import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff for retryable adapter failures.
 *
 * @param maxAttempts total adapter invocations per step, the first one included
 * @param baseDelay delay after the first failed attempt
 * @param maxDelay upper bound of any single delay before jitter
 * @param jitter fraction in [0, 1] by which a delay is randomly stretched or shrunk
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (jitter < 0.0 || jitter > 1.0) {
      throw new IllegalArgumentException("jitter must be within [0, 1]");
    }
  }

  public static RetryPolicy from(EngineSettings settings) {
    return new RetryPolicy(
        settings.retryMaxAttempts(),
        settings.retryBaseDelay(),
        settings.retryMaxDelay(),
        settings.retryJitter());
  }

  /** Whether another attempt may follow {@code attemptsMade} attempts that ended with {@code e}. */
  public boolean shouldRetry(AdapterException e, int attemptsMade) {
    return e.isRetryable() && attemptsMade < maxAttempts;
  }

  /**
   * Delay before the attempt following failed attempt number {@code attempt} (1-based).
   *
   * @param random source of uniformly distributed values in [0, 1)
   */
  public Duration backoff(int attempt, DoubleSupplier random) {
    double raw = baseDelay.toMillis() * Math.pow(2, Math.max(attempt - 1, 0));
    long delay = (long) Math.min(maxDelay.toMillis(), raw);
    if (jitter > 0 && delay > 0) {
      double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
      delay = Math.round(delay * factor);
    }
    return Duration.ofMillis(Math.max(0, delay));
  }
}
