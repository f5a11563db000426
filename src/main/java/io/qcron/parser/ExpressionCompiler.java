package io.qcron.parser;

import io.qcron.CronException;
import io.qcron.Span;
import io.qcron.constraint.ConstraintSet;
import io.qcron.constraint.Field;
import io.qcron.constraint.FieldConstraint;
import java.util.ArrayList;
import java.util.List;

/** Compiles seven-field expression text into a {@link ConstraintSet}. */
public final class ExpressionCompiler {
  private static final int FIELD_COUNT = Field.values().length;

  private ExpressionCompiler() {}

  /**
   * Compiles an expression.
   *
   * @param input the expression: second minute hour day-of-month month day-of-week year
   * @param currentYear the year that bounds {@code *} and steps in the year field
   * @return the compiled constraints
   * @throws CronException if the expression is malformed
   */
  public static ConstraintSet compile(String input, int currentYear) throws CronException {
    if (input == null || input.isBlank()) {
      throw CronException.validation("expression is empty", input);
    }

    List<FieldToken> tokens = tokenize(input);
    if (tokens.size() != FIELD_COUNT) {
      throw CronException.validation(
          "expected "
              + FIELD_COUNT
              + " fields (second minute hour day-of-month month day-of-week year), got "
              + tokens.size(),
          input);
    }

    List<FieldConstraint> constraints = new ArrayList<>(FIELD_COUNT);
    for (Field field : Field.values()) {
      FieldToken token = tokens.get(field.position());
      constraints.add(parseToken(token, field, currentYear, input));
    }
    ConstraintSet set = ConstraintSet.of(constraints);

    // Only the literal '?' token switches a day field off.
    if (tokens.get(Field.DAY_OF_MONTH.position()).text().equals("?")) {
      set = set.with(FieldConstraint.unconstrained(Field.DAY_OF_MONTH));
    } else if (tokens.get(Field.DAY_OF_WEEK.position()).text().equals("?")) {
      set = set.with(FieldConstraint.unconstrained(Field.DAY_OF_WEEK));
    }
    return set;
  }

  /**
   * Splits an expression on whitespace, recording where each token sits.
   *
   * @param input the expression
   * @return the tokens in order
   */
  public static List<FieldToken> tokenize(String input) {
    List<FieldToken> tokens = new ArrayList<>();
    int pos = 0;
    while (true) {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
      if (pos >= input.length()) {
        break;
      }
      int start = pos;
      while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
      tokens.add(new FieldToken(input.substring(start, pos), new Span(start, pos)));
    }
    return tokens;
  }

  private static FieldConstraint parseToken(
      FieldToken token, Field field, int currentYear, String input) throws CronException {
    if (field == Field.YEAR && token.text().equals("*")) {
      return FieldConstraint.unconstrained(Field.YEAR);
    }
    try {
      return FieldParser.parse(token.text(), field, currentYear);
    } catch (CronException e) {
      throw e.locate(token.span(), input);
    }
  }
}
