package io.qcron.parser;

import io.qcron.CronException;
import io.qcron.constraint.Field;
import io.qcron.constraint.FieldConstraint;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a single field token into its admissible values.
 *
 * <p>Grammar, checked in this order:
 *
 * <ul>
 *   <li>{@code ?} - no specific value, day-of-month and day-of-week only
 *   <li>{@code *} - every value of the field's domain
 *   <li>{@code base/step} - every step-th element of the base sequence, by position
 *   <li>{@code a,b-c,...} - a list of values and ranges
 *   <li>{@code start-end} - an inclusive range
 *   <li>{@code n} - a single value
 * </ul>
 */
public final class FieldParser {
  /** Largest year a field may name. */
  static final int MAX_YEAR = 9999;

  private FieldParser() {}

  /**
   * Parses a field token.
   *
   * @param token the token text
   * @param field the field the token belongs to
   * @param currentYear the year used to bound {@code *} in the year field
   * @return the parsed constraint, unconstrained for {@code ?}
   * @throws CronException if the token is malformed
   */
  public static FieldConstraint parse(String token, Field field, int currentYear)
      throws CronException {
    if (token.equals("?")) {
      if (!field.allowsNoSpecificValue()) {
        throw CronException.validation(
            "'?' is only allowed in day-of-month and day-of-week, not " + field,
            field,
            null,
            null);
      }
      return FieldConstraint.unconstrained(field);
    }
    return FieldConstraint.of(field, sequence(token, field, currentYear));
  }

  /** Parses a token into its ordered value sequence, duplicates kept. */
  private static List<Integer> sequence(String token, Field field, int currentYear)
      throws CronException {
    if (token.equals("?")) {
      throw CronException.validation(
          "'?' cannot be combined with other syntax in " + field, field, null, null);
    }

    if (token.equals("*")) {
      return range(field.min(currentYear), field.max(currentYear));
    }

    if (token.contains("/")) {
      String[] parts = token.split("/", -1);
      if (parts.length != 2) {
        throw CronException.validation(
            "invalid step expression '" + token + "' in " + field, field, null, null);
      }
      List<Integer> base = sequence(parts[0], field, currentYear);
      return positionalStep(base, parseStep(parts[1], field));
    }

    if (token.contains(",")) {
      List<Integer> values = new ArrayList<>();
      for (String element : token.split(",", -1)) {
        if (element.contains("-")) {
          values.addAll(parseRange(element, field));
        } else {
          values.add(parseValue(element, field));
        }
      }
      return values;
    }

    if (token.contains("-")) {
      return parseRange(token, field);
    }

    return List.of(parseValue(token, field));
  }

  /**
   * Keeps every step-th element of a sequence by position, starting with the first.
   *
   * <p>This is not value arithmetic: {@code 5/15} keeps only {@code 5}, and {@code 0,10,20,30/2}
   * keeps {@code 0,20}. Expressions written against this behavior rely on it, so it must not be
   * turned into cron's "every value congruent to base" rule.
   *
   * @param base the ordered base sequence
   * @param step the positive step
   * @return the selected elements, in order
   */
  static List<Integer> positionalStep(List<Integer> base, int step) {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < base.size(); i += step) {
      result.add(base.get(i));
    }
    return result;
  }

  private static List<Integer> parseRange(String text, Field field) throws CronException {
    String[] bounds = text.split("-", -1);
    if (bounds.length != 2) {
      throw CronException.validation(
          "invalid range '" + text + "' in " + field, field, null, null);
    }
    int start = parseValue(bounds[0], field);
    int end = parseValue(bounds[1], field);
    if (start > end) {
      throw CronException.validation(
          "range start must be <= end: " + start + "-" + end + " in " + field, field, null, null);
    }
    return range(start, end);
  }

  private static int parseStep(String text, Field field) throws CronException {
    int step = parseNumber(text, field, "step");
    if (step == 0) {
      throw CronException.validation("step cannot be 0 in " + field, field, null, null);
    }
    return step;
  }

  private static int parseValue(String text, Field field) throws CronException {
    int value = parseNumber(text, field, "value");
    if (field.boundsChecked()) {
      int min = field.fixedMin();
      int max = field.fixedMax();
      if (value < min || value > max) {
        throw CronException.validation(
            field + " value " + value + " out of range " + min + "-" + max, field, null, null);
      }
    } else if (value > MAX_YEAR) {
      throw CronException.validation(
          field + " value " + value + " exceeds " + MAX_YEAR, field, null, null);
    }
    return value;
  }

  /** Parses plain base-10 digits; signs and whitespace are rejected. */
  private static int parseNumber(String text, Field field, String what) throws CronException {
    if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw CronException.validation(
          "invalid " + field + " " + what + " '" + text + "'", field, null, null);
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw CronException.validation(
          field + " " + what + " '" + text + "' is too large", field, null, null);
    }
  }

  private static List<Integer> range(int start, int end) {
    List<Integer> result = new ArrayList<>(end - start + 1);
    for (int i = start; i <= end; i++) {
      result.add(i);
    }
    return result;
  }
}
