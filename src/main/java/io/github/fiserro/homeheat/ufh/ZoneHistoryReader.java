package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.AggregationType;
import io.github.fiserro.homeheat.history.HistoryQueryException;
import io.github.fiserro.homeheat.history.HistorySource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the valve and window history of a zone for one tick.
 *
 * <p>Only the observation period query is critical: without it the quota cannot be computed.
 * The valve-open and window queries fall back to the instantaneous readings.
 */
@Slf4j
@RequiredArgsConstructor
public class ZoneHistoryReader {

  static final double WINDOW_OPEN_THRESHOLD = 0.01;

  private final HistorySource source;
  private final TimingParams timing;

  public ZoneHistory read(ZoneConfig zone, ZoneReading reading, Instant observationStart,
      Instant now) {
    return new ZoneHistory(
        periodStateAvg(zone, observationStart, now),
        openStateAvg(zone, reading, now),
        windowRecentlyOpen(zone, reading, now));
  }

  private Double periodStateAvg(ZoneConfig zone, Instant observationStart, Instant now) {
    try {
      return source.stateAverage(zone.valveSwitch(), observationStart, now);
    } catch (HistoryQueryException e) {
      log.warn("Zone {}: period history of {} unavailable: {}", zone.id(), zone.valveSwitch(),
          e.getMessage());
      return null;
    }
  }

  private double openStateAvg(ZoneConfig zone, ZoneReading reading, Instant now) {
    try {
      return source.stateAverage(zone.valveSwitch(),
          now.minusSeconds(timing.valveOpenTime()), now);
    } catch (HistoryQueryException e) {
      double fallback = reading.valveState().isOn() ? 1.0 : 0.0;
      log.warn("Zone {}: valve open history unavailable, using current state {}: {}",
          zone.id(), fallback, e.getMessage());
      return fallback;
    }
  }

  private boolean windowRecentlyOpen(ZoneConfig zone, ZoneReading reading, Instant now) {
    if (reading.windowOpen()) {
      return true;
    }
    List<Double> averages = new ArrayList<>();
    Instant start = now.minusSeconds(timing.windowBlockTime());
    for (String sensor : zone.windowSensors()) {
      try {
        averages.add(source.stateAverage(sensor, start, now));
      } catch (HistoryQueryException e) {
        log.warn("Zone {}: window history of {} unavailable, using current state: {}",
            zone.id(), sensor, e.getMessage());
        return false;
      }
    }
    Double max = AggregationType.MAX.aggregate(averages);
    return max != null && max >= WINDOW_OPEN_THRESHOLD;
  }
}
