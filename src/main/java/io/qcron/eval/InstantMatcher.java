package io.qcron.eval;

import io.qcron.constraint.ConstraintSet;
import java.time.DayOfWeek;
import java.time.LocalDateTime;

/** Tests instants against compiled constraints. */
public final class InstantMatcher {
  private InstantMatcher() {}

  /**
   * Checks whether an instant satisfies every constrained field.
   *
   * <p>Fields are checked in the order second, minute, hour, day-of-month, day-of-week, month,
   * year. Day-of-month and day-of-week are checked independently, so when both are constrained an
   * instant must satisfy both.
   *
   * @param dt the instant to test
   * @param constraints the compiled constraints
   * @return true if the instant matches
   */
  public static boolean matches(LocalDateTime dt, ConstraintSet constraints) {
    return constraints.seconds().admits(dt.getSecond())
        && constraints.minutes().admits(dt.getMinute())
        && constraints.hours().admits(dt.getHour())
        && constraints.daysOfMonth().admits(dt.getDayOfMonth())
        && constraints.daysOfWeek().admits(dayOfWeek(dt.getDayOfWeek()))
        && constraints.months().admits(dt.getMonthValue())
        && constraints.years().admits(dt.getYear());
  }

  /**
   * Converts a day of week to expression numbering, where Sunday is 1 and Saturday is 7.
   *
   * @param dow the day of week
   * @return the expression day number
   */
  public static int dayOfWeek(DayOfWeek dow) {
    return dow.getValue() % 7 + 1;
  }
}
