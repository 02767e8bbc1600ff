package io.huntflow.core.lang;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/** Time window constraining GET and FIND: absolute bounds or "the last N units". */
public sealed interface Timespan permits Timespan.Absolute, Timespan.Relative {

  /** Absolute window for evaluation at the given clock's current instant. */
  Absolute resolve(Clock clock);

  /** Inclusive [start, stop] window, start not after stop. */
  record Absolute(Instant start, Instant stop) implements Timespan {
    public Absolute {
      if (start.isAfter(stop)) {
        throw new IllegalArgumentException("Timespan start " + start + " is after stop " + stop);
      }
    }

    @Override
    public Absolute resolve(Clock clock) {
      return this;
    }

    public boolean contains(Instant t) {
      return !t.isBefore(start) && !t.isAfter(stop);
    }

    /** Whether [from, to] intersects this window. */
    public boolean overlaps(Instant from, Instant to) {
      return !to.isBefore(start) && !from.isAfter(stop);
    }
  }

  /** Longest window in seconds; any clock instant minus it stays a valid {@link Instant}. */
  long MAX_WINDOW_SECONDS = Instant.MAX.getEpochSecond();

  /** "now minus count units" through "now", fixed only when resolved. */
  record Relative(long count, Huntflow.TimeUnitName unit) implements Timespan {
    public Relative {
      if (count <= 0) {
        throw new IllegalArgumentException("LAST requires a positive count, got " + count);
      }
      if (count > MAX_WINDOW_SECONDS / unit.seconds()) {
        throw new IllegalArgumentException(
            "LAST " + count + " " + unit + " exceeds the representable time range");
      }
    }

    public long seconds() {
      return count * unit.seconds();
    }

    @Override
    public Absolute resolve(Clock clock) {
      Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
      return new Absolute(now.minusSeconds(seconds()), now);
    }
  }
}
