package io.github.fiserro.homeheat.ufh;

import lombok.Builder;

/**
 * Instantaneous inputs of one zone for one tick.
 *
 * @param temperature raw sensor reading, {@code null} when the sensor is unavailable; a value
 *     that is not a finite number counts as unavailable
 * @param valveState valve read-back
 * @param windowOpen whether any window sensor of the zone currently reads open
 */
@Builder
public record ZoneReading(Double temperature, ValveState valveState, boolean windowOpen) {

  public ZoneReading {
    temperature = temperature == null || !Double.isFinite(temperature) ? null : temperature;
    valveState = valveState == null ? ValveState.UNKNOWN : valveState;
  }

  /** Reading used for a zone the caller did not report at all. */
  public static ZoneReading missing() {
    return new ZoneReading(null, ValveState.UNKNOWN, false);
  }
}
