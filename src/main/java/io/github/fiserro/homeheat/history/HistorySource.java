package io.github.fiserro.homeheat.history;

import java.time.Instant;

/**
 * Read access to the recorded state history of binary entities (valves, window sensors).
 */
public interface HistorySource {

  /**
   * Time-weighted fraction of {@code [start, end)} during which the entity was on.
   *
   * @return a value in {@code [0, 1]}; 0 when {@code start} is not before {@code end}
   * @throws HistoryQueryException when the history cannot be read
   */
  double stateAverage(String entity, Instant start, Instant end) throws HistoryQueryException;
}
