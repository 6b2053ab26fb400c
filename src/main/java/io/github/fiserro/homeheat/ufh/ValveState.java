package io.github.fiserro.homeheat.ufh;

/**
 * Read-back state of a zone valve actuator.
 *
 * <p>{@link #UNKNOWN} and {@link #UNAVAILABLE} are uncertain: the valve may be open, so every
 * decision that wants it closed must actively command it off.
 */
public enum ValveState {
  ON,
  OFF,
  UNKNOWN,
  UNAVAILABLE;

  public boolean isOn() {
    return this == ON;
  }

  public boolean isOff() {
    return this == OFF;
  }
}
