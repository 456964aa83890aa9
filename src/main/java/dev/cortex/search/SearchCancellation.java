package dev.cortex.search;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Cooperative cancellation signal polled by the ranker between candidate batches. */
@FunctionalInterface
public interface SearchCancellation {

  boolean isCancelled();

  /** Never cancels. */
  static SearchCancellation none() {
    return () -> false;
  }

  /** Cancels once {@code timeout} has elapsed on {@code clock}, counted from this call. */
  static SearchCancellation deadline(Clock clock, Duration timeout) {
    Instant deadline = clock.instant().plus(timeout);
    return () -> clock.instant().isAfter(deadline);
  }
}
