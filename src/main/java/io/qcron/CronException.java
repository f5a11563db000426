package io.qcron;

import io.qcron.constraint.Field;
import java.util.Optional;

/** Exception thrown when an expression fails to compile or has no next occurrence. */
public final class CronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The field the error relates to. */
  private final Field field;

  /** The source span of the offending token. */
  private final Span span;

  /** The original expression. */
  private final String input;

  private CronException(ErrorKind kind, String message, Field field, Span span, String input) {
    super(message);
    this.kind = kind;
    this.field = field;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a validation error that is not tied to a single field.
   *
   * @param message the error message
   * @param input the original expression, may be null
   * @return a new CronException for a validation error
   */
  public static CronException validation(String message, String input) {
    return new CronException(ErrorKind.VALIDATION, message, null, null, input);
  }

  /**
   * Creates a validation error for one field token.
   *
   * @param message the error message
   * @param field the field being parsed
   * @param span the location of the token, may be null when parsed standalone
   * @param input the original expression, may be null when parsed standalone
   * @return a new CronException for a validation error
   */
  public static CronException validation(String message, Field field, Span span, String input) {
    return new CronException(ErrorKind.VALIDATION, message, field, span, input);
  }

  /**
   * Creates a not-found error.
   *
   * @param message the error message
   * @return a new CronException for a failed search
   */
  public static CronException notFound(String message) {
    return new CronException(ErrorKind.NOT_FOUND, message, null, null, null);
  }

  /**
   * Returns a copy of this error located within a full expression.
   *
   * @param span the location of the token within the expression
   * @param input the full expression
   * @return a new CronException with span and input attached
   */
  public CronException locate(Span span, String input) {
    return new CronException(kind, getMessage(), field, span, input);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the field the error relates to, if any.
   *
   * @return the field, or empty if the error is not field specific
   */
  public Optional<Field> field() {
    return Optional.ofNullable(field);
  }

  /**
   * Returns the span of the offending token, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original expression, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending token.
   *
   * <p>For validation errors with span and input, produces output like:
   *
   * <pre>
   * error: second value 75 out of range 0-59
   *   75 0 12 * * ? *
   *   ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind == ErrorKind.VALIDATION && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
