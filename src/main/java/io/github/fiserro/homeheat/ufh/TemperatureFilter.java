package io.github.fiserro.homeheat.ufh;

/**
 * Exponential moving average used to smooth raw temperature readings.
 *
 * <pre>{@code
 *    filtered = alpha * raw + (1 - alpha) * previous, where alpha = dt / (tau + dt)
 * }</pre>
 *
 * <p>A larger time constant {@code tau} smooths more and responds slower; {@code tau <= 0}
 * disables filtering for the zone.
 */
public final class TemperatureFilter {

  private TemperatureFilter() {
  }

  /**
   * Applies the filter to one reading.
   *
   * @param raw current raw reading
   * @param previous previous filtered value, {@code null} on the first reading
   * @param tau time constant in seconds
   * @param dt seconds since the previous reading of the same zone
   * @return the filtered value; {@code raw} when there is no previous value or {@code tau <= 0},
   *     {@code previous} when {@code dt <= 0}
   */
  public static double filter(double raw, Double previous, double tau, double dt) {
    if (tau <= 0 || previous == null) {
      return raw;
    }
    if (!(dt > 0)) {
      return previous;
    }
    double alpha = dt / (tau + dt);
    return alpha * raw + (1 - alpha) * previous;
  }
}
