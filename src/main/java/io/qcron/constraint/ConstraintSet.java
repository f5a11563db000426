package io.qcron.constraint;

import java.util.List;
import java.util.Objects;

/**
 * The compiled form of a schedule expression: one constraint per field.
 *
 * @param seconds the second constraint
 * @param minutes the minute constraint
 * @param hours the hour constraint
 * @param daysOfMonth the day-of-month constraint
 * @param months the month constraint
 * @param daysOfWeek the day-of-week constraint (1 = Sunday)
 * @param years the year constraint
 */
public record ConstraintSet(
    FieldConstraint seconds,
    FieldConstraint minutes,
    FieldConstraint hours,
    FieldConstraint daysOfMonth,
    FieldConstraint months,
    FieldConstraint daysOfWeek,
    FieldConstraint years) {
  /** Validates that each constraint sits in its own slot. */
  public ConstraintSet {
    check(seconds, Field.SECOND);
    check(minutes, Field.MINUTE);
    check(hours, Field.HOUR);
    check(daysOfMonth, Field.DAY_OF_MONTH);
    check(months, Field.MONTH);
    check(daysOfWeek, Field.DAY_OF_WEEK);
    check(years, Field.YEAR);
  }

  /**
   * Creates a constraint set from constraints listed in field order.
   *
   * @param constraints exactly seven constraints, second through year
   * @return the constraint set
   */
  public static ConstraintSet of(List<FieldConstraint> constraints) {
    if (constraints.size() != Field.values().length) {
      throw new IllegalArgumentException(
          "expected " + Field.values().length + " constraints, got " + constraints.size());
    }
    return new ConstraintSet(
        constraints.get(0),
        constraints.get(1),
        constraints.get(2),
        constraints.get(3),
        constraints.get(4),
        constraints.get(5),
        constraints.get(6));
  }

  /**
   * Returns the constraint for a field.
   *
   * @param field the field
   * @return its constraint
   */
  public FieldConstraint get(Field field) {
    return switch (field) {
      case SECOND -> seconds;
      case MINUTE -> minutes;
      case HOUR -> hours;
      case DAY_OF_MONTH -> daysOfMonth;
      case MONTH -> months;
      case DAY_OF_WEEK -> daysOfWeek;
      case YEAR -> years;
    };
  }

  /**
   * Returns a copy with one field replaced.
   *
   * @param constraint the new constraint; its field selects the slot
   * @return a new ConstraintSet
   */
  public ConstraintSet with(FieldConstraint constraint) {
    FieldConstraint[] all = asList().toArray(new FieldConstraint[0]);
    all[constraint.field().position()] = constraint;
    return of(List.of(all));
  }

  /**
   * Returns all constraints in field order.
   *
   * @return the seven constraints
   */
  public List<FieldConstraint> asList() {
    return List.of(seconds, minutes, hours, daysOfMonth, months, daysOfWeek, years);
  }

  private static void check(FieldConstraint constraint, Field expected) {
    Objects.requireNonNull(constraint, expected.toString());
    if (constraint.field() != expected) {
      throw new IllegalArgumentException(
          "expected " + expected + " constraint, got " + constraint.field());
    }
  }
}
