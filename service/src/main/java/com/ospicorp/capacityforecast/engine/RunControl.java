package com.ospicorp.capacityforecast.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-supplied deadline and cancellation flag. Workers check it between units of work; a unit
 * already running is allowed to finish.
 */
public final class RunControl {
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Instant deadline;
  private final Clock clock;

  private RunControl(Instant deadline, Clock clock) {
    this.deadline = deadline;
    this.clock = clock;
  }

  public static RunControl unbounded() {
    return new RunControl(null, Clock.systemUTC());
  }

  public static RunControl withTimeout(Duration timeout) {
    return withDeadline(Instant.now().plus(timeout), Clock.systemUTC());
  }

  public static RunControl withDeadline(Instant deadline, Clock clock) {
    return new RunControl(deadline, clock);
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isStopped() {
    return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
  }
}
