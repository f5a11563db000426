package io.qcron.eval;

import io.qcron.constraint.ConstraintSet;
import io.qcron.constraint.FieldConstraint;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the next instant that satisfies a {@link ConstraintSet}.
 *
 * <h2>Search</h2>
 *
 * <p>The search starts one second after the reference instant and steps one second at a time,
 * testing each instant with {@link InstantMatcher}.
 *
 * <h2>Iteration Limits</h2>
 *
 * <p>MAX_ITERATIONS: five years of seconds (365-day years). When exhausted the search reports no
 * occurrence.
 *
 * <p>SKIP_AHEAD_THRESHOLD (10,000): once this many instants have failed, each iteration first
 * checks, in order:
 *
 * <ol>
 *   <li>year not admitted: jump to January 1 of the next year, giving up if that passes the
 *       largest admitted year
 *   <li>month not admitted: jump to the first day of the next month
 *   <li>day-of-month not admitted: jump to the start of the next day
 * </ol>
 *
 * <p>Only the first applicable jump is taken, and it replaces the one-second step for that
 * iteration. Every jump lands on midnight so the per-second scan resumes from a clean boundary.
 * Day-of-week and the time fields never trigger a jump.
 */
public final class NextOccurrenceSearch {
  private static final Logger log = LoggerFactory.getLogger(NextOccurrenceSearch.class);

  /** Maximum iterations: five years' worth of seconds. */
  static final long MAX_ITERATIONS = 5L * 365 * 24 * 60 * 60;

  /** Failed iterations before the coarse jumps are considered. */
  static final long SKIP_AHEAD_THRESHOLD = 10_000;

  private NextOccurrenceSearch() {}

  /**
   * Finds the earliest matching instant strictly after {@code start}.
   *
   * @param start the reference instant (exclusive)
   * @param constraints the compiled constraints
   * @return the next occurrence, or empty if none was found within the search bound or before
   *     {@link LocalDateTime#MAX}
   */
  public static Optional<LocalDateTime> findNext(LocalDateTime start, ConstraintSet constraints) {
    try {
      return scan(start, constraints);
    } catch (DateTimeException e) {
      log.debug("search from {} ran past the supported date range: {}", start, e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<LocalDateTime> scan(LocalDateTime start, ConstraintSet constraints) {
    LocalDateTime current = start.plusSeconds(1);
    long tries = 0;

    while (tries < MAX_ITERATIONS) {
      if (InstantMatcher.matches(current, constraints)) {
        return Optional.of(current);
      }

      current = current.plusSeconds(1);
      tries++;

      if (tries > SKIP_AHEAD_THRESHOLD) {
        FieldConstraint years = constraints.years();
        if (!years.admits(current.getYear())) {
          current = LocalDateTime.of(current.getYear() + 1, 1, 1, 0, 0, 0);
          int lastYear = years.max().getAsInt();
          if (current.getYear() > lastYear) {
            log.debug("no admitted year after {} (last is {}), start {}", current, lastYear, start);
            return Optional.empty();
          }
          log.trace("skipped to year {}", current.getYear());
          continue;
        }

        if (!constraints.months().admits(current.getMonthValue())) {
          current = current.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
          log.trace("skipped to month {}", current);
          continue;
        }

        if (!constraints.daysOfMonth().admits(current.getDayOfMonth())) {
          current = current.toLocalDate().plusDays(1).atStartOfDay();
          log.trace("skipped to day {}", current);
        }
      }
    }

    log.debug("search from {} exhausted after {} iterations", start, MAX_ITERATIONS);
    return Optional.empty();
  }

  /**
   * Returns a lazy stream of successive occurrences after the given instant.
   *
   * <p>The stream ends when a search finds nothing.
   *
   * @param from the reference instant (exclusive)
   * @param constraints the compiled constraints
   * @return a stream of occurrences in ascending order
   */
  public static Stream<LocalDateTime> occurrences(LocalDateTime from, ConstraintSet constraints) {
    Iterator<LocalDateTime> iterator =
        new Iterator<>() {
          private LocalDateTime current = from;
          private LocalDateTime next = null;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              next = findNext(current, constraints).orElse(null);
              if (next != null) {
                current = next;
              }
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return next != null;
          }

          @Override
          public LocalDateTime next() {
            computeNext();
            if (next == null) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            iterator, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT),
        false);
  }

  /**
   * Returns a lazy stream of occurrences where {@code from < occurrence <= to}.
   *
   * @param from the start instant (exclusive)
   * @param to the end instant (inclusive)
   * @param constraints the compiled constraints
   * @return a stream of occurrences in the range
   */
  public static Stream<LocalDateTime> between(
      LocalDateTime from, LocalDateTime to, ConstraintSet constraints) {
    return occurrences(from, constraints).takeWhile(dt -> !dt.isAfter(to));
  }
}
