package io.github.fiserro.homeheat.ufh;

import java.time.Duration;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/** Owns the configuration, regulator and current state of one zone. */
@Slf4j
@Getter
@Accessors(fluent = true)
public class ZoneRuntime {

  private final ZoneConfig config;
  private final PidRegulator regulator;
  @Setter
  private ZoneState state;
  @Setter
  private Instant lastSampleAt;

  public ZoneRuntime(ZoneConfig config) {
    this.config = config;
    this.regulator = PidRegulator.of(config);
    this.state = ZoneState.initial(config);
  }

  public String id() {
    return config.id();
  }

  /**
   * Injects a restored PID state unless the zone already calculated its own.
   *
   * @return whether the state was injected
   */
  public boolean restorePid(PidState pid) {
    if (pid == null || state.pid() != null) {
      return false;
    }
    state = state.withPid(regulator.clampIntegral(pid));
    log.debug("Zone {}: restored PID state {}", id(), state.pid());
    return true;
  }

  /**
   * Seconds since this zone's last temperature sample, capped at {@code maxDelta}; the tick
   * delta before the first sample. A clock that stepped back yields 0.
   */
  public double sampleDelta(Instant now, double tickDelta, double maxDelta) {
    if (lastSampleAt == null) {
      return tickDelta;
    }
    double seconds = Duration.between(lastSampleAt, now).toMillis() / 1000.0;
    if (seconds <= 0) {
      log.warn("Zone {}: sample time went back {}s, filter not advanced", id(), -seconds);
      return 0.0;
    }
    return Math.min(seconds, maxDelta);
  }
}
