package io.qcron.constraint;

/** The seven positional fields of a schedule expression, in expression order. */
public enum Field {
  SECOND("second", 0, 59, false),
  MINUTE("minute", 0, 59, false),
  HOUR("hour", 0, 23, false),
  DAY_OF_MONTH("day-of-month", 1, 31, false),
  MONTH("month", 1, 12, false),
  DAY_OF_WEEK("day-of-week", 1, 7, false),
  /** Bounds are offsets from the current year: {@code [currentYear, currentYear + 100]}. */
  YEAR("year", 0, 100, true);

  private final String displayName;
  private final int lower;
  private final int upper;
  private final boolean yearRelative;

  Field(String displayName, int lower, int upper, boolean yearRelative) {
    this.displayName = displayName;
    this.lower = lower;
    this.upper = upper;
    this.yearRelative = yearRelative;
  }

  /**
   * Returns the inclusive lower bound of this field's domain.
   *
   * <p>The year domain starts at the current year; the other domains are fixed.
   *
   * @param currentYear the year the expression is compiled in
   * @return the lower bound
   */
  public int min(int currentYear) {
    return yearRelative ? currentYear + lower : lower;
  }

  /**
   * Returns the inclusive upper bound of this field's domain.
   *
   * @param currentYear the year the expression is compiled in
   * @return the upper bound
   */
  public int max(int currentYear) {
    return yearRelative ? currentYear + upper : upper;
  }

  /**
   * Returns the lower bound of a field whose domain does not depend on the current year.
   *
   * @return the lower bound
   * @throws IllegalStateException for {@link #YEAR}
   */
  public int fixedMin() {
    requireFixed();
    return lower;
  }

  /**
   * Returns the upper bound of a field whose domain does not depend on the current year.
   *
   * @return the upper bound
   * @throws IllegalStateException for {@link #YEAR}
   */
  public int fixedMax() {
    requireFixed();
    return upper;
  }

  /**
   * Returns whether values of this field are checked against the domain bounds.
   *
   * <p>Years are relative to the compile time, so a past year is accepted and simply never
   * matches.
   *
   * @return true for every field except {@link #YEAR}
   */
  public boolean boundsChecked() {
    return !yearRelative;
  }

  /**
   * Returns whether {@code ?} is legal in this field.
   *
   * @return true for the day-of-month and day-of-week fields
   */
  public boolean allowsNoSpecificValue() {
    return this == DAY_OF_MONTH || this == DAY_OF_WEEK;
  }

  /**
   * Returns the zero-based position of this field in an expression.
   *
   * @return the position
   */
  public int position() {
    return ordinal();
  }

  @Override
  public String toString() {
    return displayName;
  }

  private void requireFixed() {
    if (yearRelative) {
      throw new IllegalStateException(displayName + " bounds depend on the current year");
    }
  }
}
