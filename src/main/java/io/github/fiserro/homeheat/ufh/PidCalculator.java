package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.Calculator;
import lombok.extern.slf4j.Slf4j;

/**
 * Updates the zone's PID state from the filtered temperature.
 *
 * <p>The regulator is paused (state kept as is) when:
 * <ul>
 *   <li>there is no temperature reading this tick</li>
 *   <li>the zone is disabled</li>
 *   <li>a window was recently open, so the drop in temperature does not wind up the integral</li>
 * </ul>
 */
@Slf4j
public class PidCalculator implements Calculator<ZoneUpdate> {

  @Override
  public ZoneUpdate calculate(ZoneUpdate update) {
    ZoneState state = update.state();
    String zoneId = update.config().id();

    if (update.reading().temperature() == null || state.temperature() == null) {
      log.debug("Zone {}: PID paused, temperature unavailable", zoneId);
      return update;
    }
    if (!state.enabled()) {
      log.debug("Zone {}: PID paused, zone disabled", zoneId);
      return update;
    }
    if (update.history().windowRecentlyOpen()) {
      log.debug("Zone {}: PID paused, window recently open", zoneId);
      return update;
    }

    PidState pid = update.regulator()
        .update(state.pid(), state.setpoint(), state.temperature(), update.tickDelta());
    return update.withState(state.withPid(pid));
  }
}
