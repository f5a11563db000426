package io.qcron;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Options for {@link CronExpression#compile(String, CompileOptions)}.
 *
 * @param referenceTime the initial cursor position; null means the current time of {@code clock}
 * @param clock the clock supplying the current time and year
 */
public record CompileOptions(LocalDateTime referenceTime, Clock clock) {
  /** Defaults the clock to the system clock. */
  public CompileOptions {
    clock = clock == null ? Clock.systemDefaultZone() : clock;
  }

  /**
   * Returns options that start at the current time of the system clock.
   *
   * @return the default options
   */
  public static CompileOptions defaults() {
    return new CompileOptions(null, null);
  }

  /**
   * Returns a copy with the specified reference time.
   *
   * @param referenceTime the initial cursor position
   * @return new options with the updated reference time
   */
  public CompileOptions withReferenceTime(LocalDateTime referenceTime) {
    return new CompileOptions(Objects.requireNonNull(referenceTime, "referenceTime"), clock);
  }

  /**
   * Returns a copy with the specified clock.
   *
   * @param clock the clock
   * @return new options with the updated clock
   */
  public CompileOptions withClock(Clock clock) {
    return new CompileOptions(referenceTime, Objects.requireNonNull(clock, "clock"));
  }

  /**
   * Returns the reference time, if one was given.
   *
   * @return the reference time
   */
  public Optional<LocalDateTime> reference() {
    return Optional.ofNullable(referenceTime);
  }
}
