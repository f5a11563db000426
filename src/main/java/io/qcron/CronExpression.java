package io.qcron;

import io.qcron.constraint.ConstraintSet;
import io.qcron.display.Display;
import io.qcron.eval.InstantMatcher;
import io.qcron.eval.NextOccurrenceSearch;
import io.qcron.parser.ExpressionCompiler;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for compiling seven-field schedule expressions and walking their
 * occurrences.
 *
 * <p>Fields are, in order: second, minute, hour, day-of-month, month, day-of-week (1 = Sunday),
 * year. A compiled expression holds a cursor; each call to {@link #next()} returns the first
 * matching instant after the cursor and moves the cursor there.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CronExpression noon = CronExpression.compile(
 *     "0 0 12 * * ? *",
 *     CompileOptions.defaults().withReferenceTime(LocalDateTime.of(2024, 1, 1, 0, 0)));
 * Occurrence first = noon.next();   // 2024-01-01T12:00
 * Occurrence second = noon.next();  // 2024-01-02T12:00
 * }</pre>
 *
 * <p>Instances are not thread-safe: concurrent calls to {@link #next()} on one instance race on
 * the cursor. Separately compiled instances share no state.
 */
public final class CronExpression {
  private static final Logger log = LoggerFactory.getLogger(CronExpression.class);

  private final String expression;
  private final ConstraintSet constraints;
  private LocalDateTime current;

  private CronExpression(String expression, ConstraintSet constraints, LocalDateTime current) {
    this.expression = expression;
    this.constraints = constraints;
    this.current = current;
  }

  /**
   * Compiles an expression with the cursor at the current time.
   *
   * @param expression the seven-field expression
   * @return the compiled expression
   * @throws CronException if the expression is invalid
   */
  public static CronExpression compile(String expression) throws CronException {
    return compile(expression, CompileOptions.defaults());
  }

  /**
   * Compiles an expression.
   *
   * @param expression the seven-field expression
   * @param options the reference time and clock
   * @return the compiled expression
   * @throws CronException if the expression is invalid
   */
  public static CronExpression compile(String expression, CompileOptions options)
      throws CronException {
    Objects.requireNonNull(options, "options");
    LocalDateTime now = LocalDateTime.now(options.clock());
    ConstraintSet constraints = ExpressionCompiler.compile(expression, now.getYear());
    LocalDateTime start = options.reference().orElse(now).truncatedTo(ChronoUnit.SECONDS);
    if (log.isDebugEnabled()) {
      log.debug(
          "compiled '{}' as '{}', cursor at {}", expression, Display.render(constraints), start);
    }
    return new CronExpression(expression, constraints, start);
  }

  /**
   * Validates an expression without throwing.
   *
   * @param expression the expression
   * @return true if the expression compiles
   */
  public static boolean validate(String expression) {
    try {
      compile(expression);
      return true;
    } catch (CronException e) {
      return false;
    }
  }

  /**
   * Computes the next occurrence after the cursor and advances the cursor to it.
   *
   * @return the next occurrence
   * @throws CronException of kind {@link ErrorKind#NOT_FOUND} if no occurrence exists within the
   *     search bound; the cursor is left unchanged
   */
  public Occurrence next() throws CronException {
    Optional<LocalDateTime> next = NextOccurrenceSearch.findNext(current, constraints);
    if (next.isEmpty()) {
      throw CronException.notFound(
          "no occurrence of '" + expression + "' found after " + current);
    }
    current = next.get();
    return new Occurrence(current);
  }

  /**
   * Computes up to n successive occurrences, advancing the cursor past each.
   *
   * @param n the number of occurrences wanted
   * @return the occurrences found, fewer than n if the schedule runs out
   */
  public List<Occurrence> nextN(int n) {
    List<Occurrence> results = new ArrayList<>(Math.max(0, n));
    for (int i = 0; i < n; i++) {
      Optional<LocalDateTime> next = NextOccurrenceSearch.findNext(current, constraints);
      if (next.isEmpty()) {
        break;
      }
      current = next.get();
      results.add(new Occurrence(current));
    }
    return results;
  }

  /**
   * Computes the next occurrence after the given instant without touching the cursor.
   *
   * @param from the reference instant (exclusive)
   * @return the next occurrence, or empty if none exists within the search bound
   */
  public Optional<LocalDateTime> nextFrom(LocalDateTime from) {
    return NextOccurrenceSearch.findNext(from.truncatedTo(ChronoUnit.SECONDS), constraints);
  }

  /**
   * Checks if an instant matches this expression.
   *
   * @param dt the instant to check
   * @return true if the instant matches
   */
  public boolean matches(LocalDateTime dt) {
    return InstantMatcher.matches(dt, constraints);
  }

  /**
   * Returns a lazy stream of occurrences after the given instant. The cursor is not touched.
   *
   * @param from the reference instant (exclusive)
   * @return a stream of occurrences
   */
  public Stream<LocalDateTime> occurrences(LocalDateTime from) {
    return NextOccurrenceSearch.occurrences(from.truncatedTo(ChronoUnit.SECONDS), constraints);
  }

  /**
   * Returns a lazy stream of occurrences where from &lt; occurrence &lt;= to. The cursor is not
   * touched.
   *
   * @param from the start instant (exclusive)
   * @param to the end instant (inclusive)
   * @return a stream of occurrences in the range
   */
  public Stream<LocalDateTime> between(LocalDateTime from, LocalDateTime to) {
    return NextOccurrenceSearch.between(
        from.truncatedTo(ChronoUnit.SECONDS), to, constraints);
  }

  /**
   * Returns the cursor: the instant the next search starts after.
   *
   * @return the cursor
   */
  public LocalDateTime current() {
    return current;
  }

  /**
   * Moves the cursor.
   *
   * @param to the new cursor position, truncated to whole seconds
   */
  public void reset(LocalDateTime to) {
    current = Objects.requireNonNull(to, "to").truncatedTo(ChronoUnit.SECONDS);
  }

  /**
   * Returns the expression text this instance was compiled from.
   *
   * @return the source expression
   */
  public String expression() {
    return expression;
  }

  /**
   * Returns the compiled constraints.
   *
   * @return the constraint set
   */
  public ConstraintSet constraints() {
    return constraints;
  }

  /**
   * Returns the canonical form of this expression.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(constraints);
  }
}
