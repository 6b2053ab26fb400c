package io.github.fiserro.homeheat.ufh;

/**
 * Rounds a temperature for display with hysteresis, so a value hovering around a
 * quantization boundary does not flicker.
 *
 * <p>Example with the 0.1 step and 0.03 margin, current display 20.0:
 * <ul>
 *   <li>raw must reach 20.08 to show 20.1</li>
 *   <li>raw must drop to 19.92 to show 19.9</li>
 *   <li>anything in between keeps 20.0</li>
 * </ul>
 *
 * <p>Only the display is quantized; control always uses the filtered value.
 */
public final class DisplayRounding {

  public static final double PRECISION = 0.1;
  public static final double HYSTERESIS_MARGIN = 0.03;

  private static final double STEPS_PER_UNIT = 1 / PRECISION;

  private DisplayRounding() {
  }

  /**
   * @param raw filtered temperature
   * @param previousDisplay last displayed value, {@code null} on the first call
   * @return the value to display
   */
  public static double round(double raw, Double previousDisplay) {
    double target = Math.round(raw * STEPS_PER_UNIT) / STEPS_PER_UNIT;
    if (previousDisplay == null) {
      return target;
    }
    if (Math.abs(target - previousDisplay) < PRECISION / 2) {
      return previousDisplay;
    }
    if (target > previousDisplay) {
      double boundary = previousDisplay + PRECISION / 2;
      return raw >= boundary + HYSTERESIS_MARGIN ? target : previousDisplay;
    }
    double boundary = previousDisplay - PRECISION / 2;
    return raw <= boundary - HYSTERESIS_MARGIN ? target : previousDisplay;
  }
}
