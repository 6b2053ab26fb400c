package io.github.fiserro.homeheat.ufh;

import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Quota-based valve scheduling of a single zone.
 *
 * <p>Priority-based decision tree of {@link #evaluateZone}:
 * <ol>
 *   <li>Zone disabled → off</li>
 *   <li>Flush circuit while the controller requests flushing → on, quota bypassed</li>
 *   <li>Less than the minimum run time left in the observation period → hold the current
 *       state</li>
 *   <li>Quota not a finite number → off</li>
 *   <li>Quota met → off</li>
 *   <li>Remaining quota shorter than the minimum run time → off</li>
 *   <li>DHW active, regular circuit, valve not running → off (wait for DHW)</li>
 *   <li>Default → on</li>
 * </ol>
 *
 * <p>Every "off" closes an uncertain valve actively; see {@link ZoneAction#off(ValveState)}.
 */
@Slf4j
public final class ZoneScheduler {

  private ZoneScheduler() {
  }

  public static ZoneAction evaluateZone(ZoneState zone, ControllerState controller,
      TimingParams timing, CircuitType circuitType) {
    ValveState valve = zone.valveState();

    if (!zone.enabled()) {
      return ZoneAction.off(valve);
    }

    if (circuitType == CircuitType.FLUSH && controller.flushRequest()) {
      return ZoneAction.on(valve);
    }

    double periodRemaining = timing.observationPeriod() - controller.periodElapsed();
    if (periodRemaining < timing.minRunTime()) {
      log.debug("Period ends in {}s, freezing valve state {}", periodRemaining, valve);
      return ZoneAction.hold(valve);
    }

    if (!Double.isFinite(zone.usedDuration()) || !Double.isFinite(zone.requestedDuration())) {
      log.warn("Quota not finite (requested={}s, used={}s), closing valve",
          zone.requestedDuration(), zone.usedDuration());
      return ZoneAction.off(valve);
    }

    if (zone.usedDuration() >= zone.requestedDuration()) {
      return ZoneAction.off(valve);
    }

    if (zone.remainingQuota() < timing.minRunTime()) {
      return ZoneAction.off(valve);
    }

    if (controller.dhwActive() && circuitType == CircuitType.REGULAR && !valve.isOn()) {
      return ZoneAction.off(valve);
    }

    return ZoneAction.on(valve);
  }

  /**
   * Whether a zone contributes to the boiler heat request: the valve is confirmed and
   * physically open, and enough quota is left that it will not close within the closing
   * warning duration.
   */
  public static boolean shouldRequestHeat(ZoneState zone, TimingParams timing,
      double valveOpenThreshold) {
    if (!zone.valveState().isOn() || !zone.enabled()) {
      return false;
    }
    if (zone.openStateAvg() < valveOpenThreshold) {
      return false;
    }
    return zone.remainingQuota() >= timing.closingWarningDuration();
  }

  /**
   * Whether flush circuits should run: flushing is enabled, DHW is active or its post-DHW
   * window has not expired, and no regular circuit is running this tick.
   */
  public static boolean computeFlushRequest(boolean flushEnabled, boolean dhwActive,
      Instant flushUntil, boolean anyRegularOn, Instant now) {
    if (!flushEnabled || anyRegularOn) {
      return false;
    }
    return dhwActive || (flushUntil != null && now.isBefore(flushUntil));
  }

  /**
   * Seconds a zone is entitled to in a full period; 0 before the first PID calculation or for
   * a duty cycle that is not a finite number.
   */
  public static double requestedDuration(Double dutyCycle, int observationPeriod) {
    if (dutyCycle == null || !Double.isFinite(dutyCycle)) {
      return 0.0;
    }
    return clamp(dutyCycle / 100.0 * observationPeriod, observationPeriod);
  }

  /** Seconds the valve was on so far in the current period. */
  public static double usedDuration(double periodStateAvg, double periodElapsed,
      int observationPeriod) {
    if (!Double.isFinite(periodStateAvg) || !Double.isFinite(periodElapsed)) {
      return 0.0;
    }
    return clamp(periodStateAvg * periodElapsed, observationPeriod);
  }

  private static double clamp(double seconds, int observationPeriod) {
    return Math.max(0.0, Math.min(observationPeriod, seconds));
  }
}
