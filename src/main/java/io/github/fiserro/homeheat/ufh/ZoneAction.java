package io.github.fiserro.homeheat.ufh;

/**
 * Action to take on a zone valve in one tick.
 *
 * <p>{@code TURN_*} actions require a command to the actuator, {@code STAY_*} actions only
 * confirm the state the valve already reports.
 */
public enum ZoneAction {
  TURN_ON,
  TURN_OFF,
  STAY_ON,
  STAY_OFF;

  /** Whether the valve is open after this action. */
  public boolean opensValve() {
    return this == TURN_ON || this == STAY_ON;
  }

  /** Whether this action must be sent to the actuator. */
  public boolean requiresCommand() {
    return this == TURN_ON || this == TURN_OFF;
  }

  /** Open the valve: {@link #STAY_ON} only if it reads confirmed on. */
  public static ZoneAction on(ValveState valve) {
    return valve.isOn() ? STAY_ON : TURN_ON;
  }

  /** Close the valve: {@link #STAY_OFF} only if it reads confirmed off. */
  public static ZoneAction off(ValveState valve) {
    return valve.isOff() ? STAY_OFF : TURN_OFF;
  }

  /** Keep the current valve state; an uncertain valve is closed. */
  public static ZoneAction hold(ValveState valve) {
    return switch (valve) {
      case ON -> STAY_ON;
      case OFF -> STAY_OFF;
      case UNKNOWN, UNAVAILABLE -> TURN_OFF;
    };
  }
}
