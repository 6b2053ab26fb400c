package io.github.fiserro.homeheat.ufh;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/**
 * Inputs of one controller tick.
 *
 * @param dtSeconds seconds since the previous tick
 * @param dhwActive whether the secondary heat source is heating domestic hot water
 * @param readings instantaneous zone readings by zone id; a missing zone has no data
 */
@Builder
public record TickInput(
    Instant now,
    double dtSeconds,
    boolean dhwActive,
    Map<String, ZoneReading> readings) {

  public TickInput {
    readings = readings == null ? ImmutableMap.of() : ImmutableMap.copyOf(readings);
  }

  public ZoneReading reading(String zoneId) {
    return readings.getOrDefault(zoneId, ZoneReading.missing());
  }
}
