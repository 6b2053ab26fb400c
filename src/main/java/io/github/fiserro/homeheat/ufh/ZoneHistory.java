package io.github.fiserro.homeheat.ufh;

/**
 * Historical averages of one zone for one tick, as read by {@link ZoneHistoryReader}.
 *
 * @param periodStateAvg fraction of the current observation period the valve was on;
 *     {@code null} when the query failed
 * @param openStateAvg fraction of the recent valve-open window the valve was on
 * @param windowRecentlyOpen whether a window was open within the window block time
 */
public record ZoneHistory(Double periodStateAvg, double openStateAvg, boolean windowRecentlyOpen) {

  /** The quota accounting query failed: the zone cannot be scheduled this tick. */
  public boolean periodFailed() {
    return periodStateAvg == null;
  }
}
