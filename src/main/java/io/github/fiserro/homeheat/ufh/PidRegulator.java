package io.github.fiserro.homeheat.ufh;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * PID regulator with anti-windup producing a 0-100 % duty cycle per zone.
 *
 * <p>The regulator holds only its gains. The accumulated state travels as an explicit
 * {@link PidState}: every update takes the prior snapshot and returns a new one, so a state
 * restored from storage is injected simply by passing it as {@code prior}.
 *
 * <p>Logic:
 * <ul>
 *   <li>{@code dt <= 0}: no-op, the prior state is returned unchanged (possibly {@code null})</li>
 *   <li>error = setpoint - current, P = kp * error</li>
 *   <li>I = clamp(prior I + ki * error * dt, integralMin, integralMax)</li>
 *   <li>D = kd * (error - prior error) / dt, 0 without a prior state</li>
 *   <li>duty cycle = clamp(P + I + D, 0, 100)</li>
 * </ul>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class PidRegulator {

  public static final double MIN_OUTPUT = 0.0;
  public static final double MAX_OUTPUT = 100.0;

  private final double kp;
  private final double ki;
  private final double kd;
  private final double integralMin;
  private final double integralMax;

  public static PidRegulator of(ZoneConfig config) {
    return new PidRegulator(
        config.kp(), config.ki(), config.kd(), config.integralMin(), config.integralMax());
  }

  /**
   * Calculates a new duty cycle.
   *
   * @param prior state of the previous update, {@code null} before the first one
   * @param setpoint target temperature
   * @param current measured (filtered) temperature
   * @param dt seconds since the previous update
   * @return the new state, or {@code prior} when {@code dt <= 0} or an input is not finite
   */
  public PidState update(PidState prior, double setpoint, double current, double dt) {
    if (!(dt > 0)) {
      log.debug("PID: non-positive dt {}, keeping prior state", dt);
      return prior;
    }
    if (!Double.isFinite(setpoint) || !Double.isFinite(current)) {
      log.warn("PID: setpoint {} or temperature {} not finite, keeping prior state", setpoint,
          current);
      return prior;
    }

    double error = setpoint - current;
    double proportional = kp * error;

    double priorIntegral = prior == null ? 0.0 : prior.integral();
    double integral = clamp(priorIntegral + ki * error * dt, integralMin, integralMax);

    double derivative = prior == null ? 0.0 : kd * (error - prior.error()) / dt;

    double dutyCycle = clamp(proportional + integral + derivative, MIN_OUTPUT, MAX_OUTPUT);

    log.debug("PID: error={}, p={}, i={}, d={}, duty={}",
        error, proportional, integral, derivative, dutyCycle);
    return new PidState(error, proportional, integral, derivative, dutyCycle);
  }

  /** Clamps a restored integral into this regulator's anti-windup bounds. */
  public PidState clampIntegral(PidState state) {
    double integral = clamp(state.integral(), integralMin, integralMax);
    return integral == state.integral()
        ? state
        : new PidState(state.error(), state.proportional(), integral, state.derivative(),
            state.dutyCycle());
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
