package com.gentoro.fedquery.engine;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Waits between retry attempts. Replaced in tests to avoid real delays. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = delay -> TimeUnit.MILLISECONDS.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
