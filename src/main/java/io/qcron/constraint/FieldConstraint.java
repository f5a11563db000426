package io.qcron.constraint;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The admissible values of one field.
 *
 * <p>An empty constraint is <em>unconstrained</em>: it admits every value. Values are held
 * distinct and in ascending order.
 */
public final class FieldConstraint {
  private final Field field;
  private final List<Integer> values;
  private final BitSet lookup;

  private FieldConstraint(Field field, List<Integer> values) {
    this.field = field;
    this.values = values;
    this.lookup = new BitSet();
    for (int v : values) {
      lookup.set(v);
    }
  }

  /**
   * Creates an unconstrained field.
   *
   * @param field the field
   * @return a constraint that admits any value
   */
  public static FieldConstraint unconstrained(Field field) {
    return new FieldConstraint(field, List.of());
  }

  /**
   * Creates a constraint from the given values.
   *
   * <p>Duplicates are removed and the values sorted. An empty collection yields an unconstrained
   * field.
   *
   * @param field the field
   * @param values the admissible values, all non-negative
   * @return the constraint
   */
  public static FieldConstraint of(Field field, Collection<Integer> values) {
    Objects.requireNonNull(field, "field");
    List<Integer> sorted = values.stream().distinct().sorted().toList();
    return new FieldConstraint(field, sorted);
  }

  /**
   * Returns the field this constraint applies to.
   *
   * @return the field
   */
  public Field field() {
    return field;
  }

  /**
   * Returns the admissible values in ascending order.
   *
   * @return the values, empty when unconstrained
   */
  public List<Integer> values() {
    return values;
  }

  /**
   * Returns whether this field accepts any value.
   *
   * @return true if no values were given
   */
  public boolean isUnconstrained() {
    return values.isEmpty();
  }

  /**
   * Returns whether the value is listed. Always false for an unconstrained field.
   *
   * @param value the value to look up
   * @return true if the value is one of {@link #values()}
   */
  public boolean contains(int value) {
    return value >= 0 && lookup.get(value);
  }

  /**
   * Returns whether a component with this value satisfies the constraint.
   *
   * @param value the component value
   * @return true if unconstrained or the value is listed
   */
  public boolean admits(int value) {
    return isUnconstrained() || contains(value);
  }

  /**
   * Returns the largest listed value.
   *
   * @return the maximum, or empty when unconstrained
   */
  public OptionalInt max() {
    return isUnconstrained() ? OptionalInt.empty() : OptionalInt.of(values.get(values.size() - 1));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldConstraint other)) {
      return false;
    }
    return field == other.field && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(field, values);
  }

  @Override
  public String toString() {
    return field + (isUnconstrained() ? "=<any>" : "=" + values);
  }
}
