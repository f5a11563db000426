package io.qcron.display;

import io.qcron.constraint.ConstraintSet;
import io.qcron.constraint.Field;
import io.qcron.constraint.FieldConstraint;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Renders compiled constraints as canonical expression text. */
public final class Display {
  private Display() {}

  /**
   * Renders a constraint set as a seven-field expression.
   *
   * <p>The output compiles back to an equivalent constraint set.
   *
   * @param constraints the constraints to render
   * @return the canonical expression
   */
  public static String render(ConstraintSet constraints) {
    return constraints.asList().stream().map(Display::renderField).collect(Collectors.joining(" "));
  }

  /**
   * Renders a single field.
   *
   * @param constraint the field constraint
   * @return {@code ?} or {@code *} for an unconstrained field, {@code *} for a full fixed domain,
   *     otherwise ascending values and ranges
   */
  public static String renderField(FieldConstraint constraint) {
    Field field = constraint.field();
    if (constraint.isUnconstrained()) {
      return field.allowsNoSpecificValue() ? "?" : "*";
    }
    List<Integer> values = constraint.values();
    if (field.boundsChecked() && coversDomain(values, field)) {
      return "*";
    }
    return renderRuns(values);
  }

  private static boolean coversDomain(List<Integer> values, Field field) {
    return values.size() == field.fixedMax() - field.fixedMin() + 1;
  }

  /** Joins sorted values, collapsing runs of three or more into a range. */
  private static String renderRuns(List<Integer> values) {
    List<String> parts = new ArrayList<>();
    int i = 0;
    while (i < values.size()) {
      int j = i;
      while (j + 1 < values.size() && values.get(j + 1) == values.get(j) + 1) {
        j++;
      }
      if (j - i >= 2) {
        parts.add(values.get(i) + "-" + values.get(j));
      } else {
        for (int k = i; k <= j; k++) {
          parts.add(String.valueOf(values.get(k)));
        }
      }
      i = j + 1;
    }
    return String.join(",", parts);
  }
}
