package io.qcron;

/** The type of error raised while compiling or evaluating a schedule expression. */
public enum ErrorKind {
  /** Validation error - the expression text is malformed. */
  VALIDATION("validation"),
  /** Not found - no matching instant exists within the search bound. */
  NOT_FOUND("not_found");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
