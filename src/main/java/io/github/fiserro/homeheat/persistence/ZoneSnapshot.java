package io.github.fiserro.homeheat.persistence;

import io.github.fiserro.homeheat.ufh.PidState;
import io.github.fiserro.homeheat.ufh.ZoneState;

/** Persisted part of one zone's state. */
public record ZoneSnapshot(
    PidState pid,
    double setpoint,
    boolean enabled,
    String presetMode,
    Double temperature,
    Double displayTemperature) {

  public static ZoneSnapshot of(ZoneState state) {
    return new ZoneSnapshot(state.pid(), state.setpoint(), state.enabled(), state.presetMode(),
        state.temperature(), state.displayTemperature());
  }
}
