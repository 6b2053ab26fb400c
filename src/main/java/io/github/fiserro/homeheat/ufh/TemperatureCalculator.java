package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.Calculator;
import lombok.extern.slf4j.Slf4j;

/**
 * Smooths the raw temperature reading and derives the display value.
 *
 * <p>Without a reading the last-known filtered and display values are kept.
 */
@Slf4j
public class TemperatureCalculator implements Calculator<ZoneUpdate> {

  @Override
  public ZoneUpdate calculate(ZoneUpdate update) {
    ZoneState state = update.state();
    Double raw = update.reading().temperature();
    if (raw == null) {
      log.debug("Zone {}: no temperature reading, keeping {}", update.config().id(),
          state.temperature());
      return update;
    }

    double filtered = TemperatureFilter.filter(
        raw, state.temperature(), update.config().emaTimeConstant(), update.sampleDelta());
    double display = DisplayRounding.round(filtered, state.displayTemperature());

    log.debug("Zone {}: raw={}, filtered={}, display={}", update.config().id(), raw, filtered,
        display);
    return update.withState(state.withTemperature(filtered).withDisplayTemperature(display));
  }
}
