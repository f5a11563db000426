package io.qcron;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * An instant at which a schedule fires.
 *
 * @param value the instant, with whole-second precision
 */
public record Occurrence(LocalDateTime value) implements Comparable<Occurrence> {
  /** Rejects null instants. */
  public Occurrence {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public int compareTo(Occurrence other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
