package com.gentoro.fedquery.config;

import com.gentoro.fedquery.exception.ConfigurationException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view over the {@code engine.*} configuration keys.
 *
 * @param workerThreads threads available to run query steps
 * @param maxConcurrentQueries upper bound of query steps in flight at the same time
 * @param planDeadline default overall deadline of one plan execution
 * @param stepTimeout upper bound for a single adapter invocation
 * @param retryMaxAttempts total adapter invocations allowed per query step
 * @param retryBaseDelay delay before the second attempt, doubled for every further attempt
 * @param retryMaxDelay cap for the exponential delay
 * @param retryJitter fraction of the delay randomized in both directions, within [0, 1]
 */
public record EngineSettings(
    int workerThreads,
    int maxConcurrentQueries,
    Duration planDeadline,
    Duration stepTimeout,
    int retryMaxAttempts,
    Duration retryBaseDelay,
    Duration retryMaxDelay,
    double retryJitter) {

  public EngineSettings {
    if (workerThreads < 1) {
      throw new ConfigurationException("engine.worker-threads must be >= 1");
    }
    if (maxConcurrentQueries < 1) {
      throw new ConfigurationException("engine.max-concurrent-queries must be >= 1");
    }
    if (planDeadline.isNegative() || planDeadline.isZero()) {
      throw new ConfigurationException("engine.plan-deadline-ms must be > 0");
    }
    if (stepTimeout.isNegative() || stepTimeout.isZero()) {
      throw new ConfigurationException("engine.step-timeout-ms must be > 0");
    }
    if (retryMaxAttempts < 1) {
      throw new ConfigurationException("engine.retry.max-attempts must be >= 1");
    }
    if (retryJitter < 0.0 || retryJitter > 1.0) {
      throw new ConfigurationException("engine.retry.jitter must be within [0, 1]");
    }
  }

  public static EngineSettings defaults() {
    return new EngineSettings(
        16,
        8,
        Duration.ofSeconds(30),
        Duration.ofSeconds(10),
        3,
        Duration.ofMillis(100),
        Duration.ofSeconds(2),
        0.2);
  }

  public static EngineSettings from(Configuration configuration) {
    EngineSettings d = defaults();
    return new EngineSettings(
        configuration.getInt("engine.worker-threads", d.workerThreads()),
        configuration.getInt("engine.max-concurrent-queries", d.maxConcurrentQueries()),
        Duration.ofMillis(
            configuration.getLong("engine.plan-deadline-ms", d.planDeadline().toMillis())),
        Duration.ofMillis(
            configuration.getLong("engine.step-timeout-ms", d.stepTimeout().toMillis())),
        configuration.getInt("engine.retry.max-attempts", d.retryMaxAttempts()),
        Duration.ofMillis(
            configuration.getLong("engine.retry.base-delay-ms", d.retryBaseDelay().toMillis())),
        Duration.ofMillis(
            configuration.getLong("engine.retry.max-delay-ms", d.retryMaxDelay().toMillis())),
        configuration.getDouble("engine.retry.jitter", d.retryJitter()));
  }

  public EngineSettings withMaxConcurrentQueries(int value) {
    return new EngineSettings(
        workerThreads, value, planDeadline, stepTimeout, retryMaxAttempts, retryBaseDelay,
        retryMaxDelay, retryJitter);
  }

  public EngineSettings withPlanDeadline(Duration value) {
    return new EngineSettings(
        workerThreads, maxConcurrentQueries, value, stepTimeout, retryMaxAttempts, retryBaseDelay,
        retryMaxDelay, retryJitter);
  }

  public EngineSettings withRetry(int maxAttempts, Duration baseDelay, Duration maxDelay) {
    return new EngineSettings(
        workerThreads, maxConcurrentQueries, planDeadline, stepTimeout, maxAttempts, baseDelay,
        maxDelay, retryJitter);
  }
}
