package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.Calculator;
import java.util.function.Function;

/**
 * Facade calculator that chains all per-zone calculation steps of one tick.
 *
 * <p>This calculator delegates to:
 * <ol>
 *   <li>{@link TemperatureCalculator} - EMA filter and display rounding</li>
 *   <li>{@link PidCalculator} - duty cycle from the filtered temperature</li>
 *   <li>{@link QuotaCalculator} - requested and used durations from the duty cycle</li>
 * </ol>
 */
public class ZoneUpdateCalculator implements Calculator<ZoneUpdate> {

  private final Function<ZoneUpdate, ZoneUpdate> chain = new TemperatureCalculator()
      .andThen(new PidCalculator())
      .andThen(new QuotaCalculator());

  @Override
  public ZoneUpdate calculate(ZoneUpdate update) {
    return chain.apply(update);
  }
}
