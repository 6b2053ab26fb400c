package io.github.fiserro.homeheat.ufh;

import java.time.Instant;
import lombok.Builder;
import lombok.With;

/**
 * Runtime state of a single zone at a given moment. Owned by its {@link ZoneRuntime}, which
 * replaces it on every tick.
 *
 * <p>Optional values are {@code null} until known. In particular {@code pid} stays {@code null}
 * until the first PID calculation, so a zone without data never reports a misleading 0 %
 * demand.
 */
@With
@Builder(toBuilder = true)
public record ZoneState(
    Double temperature,
    Double displayTemperature,
    double setpoint,
    boolean enabled,
    String presetMode,
    ValveState valveState,
    PidState pid,
    double periodStateAvg,
    double openStateAvg,
    boolean windowRecentlyOpen,
    double usedDuration,
    double requestedDuration,
    boolean quotaStale,
    ZoneStatus zoneStatus,
    int consecutiveFailures,
    Instant lastSuccessfulUpdate,
    Instant failingSince) {

  public static ZoneState initial(ZoneConfig config) {
    return builder()
        .setpoint(config.setpointDefault())
        .enabled(true)
        .valveState(ValveState.UNKNOWN)
        .zoneStatus(ZoneStatus.INITIALIZING)
        .build();
  }

  /** Duty cycle of the last PID calculation, {@code null} before the first one. */
  public Double dutyCycle() {
    return pid == null ? null : pid.dutyCycle();
  }

  /** Seconds of quota left in the current observation period; negative when overrun. */
  public double remainingQuota() {
    return requestedDuration - usedDuration;
  }

  public boolean failSafe() {
    return zoneStatus == ZoneStatus.FAIL_SAFE;
  }
}
