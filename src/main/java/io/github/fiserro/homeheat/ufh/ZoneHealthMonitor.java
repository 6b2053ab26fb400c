package io.github.fiserro.homeheat.ufh;

import java.time.Duration;
import java.time.Instant;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-zone health state machine.
 *
 * <p>A tick fails when the temperature is unavailable, the critical history query failed or
 * the valve entity is unavailable. Transitions:
 * <pre>
 *   INITIALIZING --success--> NORMAL
 *   INITIALIZING --failing longer than initializingTimeout--> FAIL_SAFE
 *   NORMAL --failure--> DEGRADED
 *   NORMAL/DEGRADED --failing longer than failSafeTimeout--> FAIL_SAFE
 *   DEGRADED/FAIL_SAFE --success--> NORMAL
 * </pre>
 *
 * <p>The failure clock starts at the last successful update; a zone that never succeeded
 * counts from its first failure.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class ZoneHealthMonitor {

  private final int initializingTimeout;
  private final int failSafeTimeout;
  private final int failureWarningThreshold;

  public static ZoneHealthMonitor of(ControllerConfig config) {
    return new ZoneHealthMonitor(config.initializingTimeout(), config.failSafeTimeout(),
        config.failureWarningThreshold());
  }

  public ZoneHealthResult update(String zoneId, ZoneState state, Instant now,
      boolean temperatureUnavailable, boolean historyFailure, boolean valveUnavailable) {
    ZoneStatus status = state.zoneStatus();
    int timeout = status == ZoneStatus.INITIALIZING ? initializingTimeout : failSafeTimeout;

    if (!temperatureUnavailable && !historyFailure && !valveUnavailable) {
      return success(zoneId, state, now, timeout);
    }

    int failures = state.consecutiveFailures() + 1;
    Instant failingSince = state.failingSince() == null ? now : state.failingSince();
    if (failures == failureWarningThreshold) {
      log.warn("Zone {}: {} consecutive failures (temperature unavailable={}, history "
              + "failure={}, valve unavailable={})", zoneId, failures, temperatureUnavailable,
          historyFailure, valveUnavailable);
    }

    Instant reference = state.lastSuccessfulUpdate() != null
        ? state.lastSuccessfulUpdate()
        : failingSince;
    Duration elapsed = Duration.between(reference, now);

    ZoneStatus next = status;
    ZoneStatusTransition transition = ZoneStatusTransition.NONE;
    if (status != ZoneStatus.FAIL_SAFE && elapsed.compareTo(Duration.ofSeconds(timeout)) > 0) {
      log.error("Zone {}: failing for {}s (timeout {}s), entering FAIL_SAFE", zoneId,
          elapsed.toMillis() / 1000.0, timeout);
      next = ZoneStatus.FAIL_SAFE;
      transition = ZoneStatusTransition.ENTERED_FAIL_SAFE;
    } else if (status == ZoneStatus.NORMAL) {
      log.debug("Zone {}: degraded after failure", zoneId);
      next = ZoneStatus.DEGRADED;
      transition = ZoneStatusTransition.ENTERED_DEGRADED;
    }

    ZoneState updated = state.toBuilder()
        .zoneStatus(next)
        .consecutiveFailures(failures)
        .failingSince(failingSince)
        .build();
    return new ZoneHealthResult(updated, transition, timeout);
  }

  private ZoneHealthResult success(String zoneId, ZoneState state, Instant now, int timeout) {
    ZoneStatusTransition transition = switch (state.zoneStatus()) {
      case INITIALIZING -> ZoneStatusTransition.INITIALIZED;
      case DEGRADED, FAIL_SAFE -> ZoneStatusTransition.RECOVERED;
      case NORMAL -> ZoneStatusTransition.NONE;
    };
    if (transition == ZoneStatusTransition.RECOVERED) {
      log.info("Zone {}: recovered from {} after {} failures", zoneId, state.zoneStatus(),
          state.consecutiveFailures());
    } else if (transition == ZoneStatusTransition.INITIALIZED) {
      log.info("Zone {}: initialized", zoneId);
    }

    ZoneState updated = state.toBuilder()
        .zoneStatus(ZoneStatus.NORMAL)
        .consecutiveFailures(0)
        .lastSuccessfulUpdate(now)
        .failingSince(null)
        .build();
    return new ZoneHealthResult(updated, transition, timeout);
  }
}
