package io.github.fiserro.homeheat;

import java.util.Collection;
import java.util.OptionalDouble;

/**
 * Aggregation type for combining multiple numeric readings, e.g. the open ratios of all window
 * sensors of one zone.
 *
 * <p>Returns {@code null} for an empty collection.
 */
public enum AggregationType {
  MAX {
    @Override
    public Double aggregate(Collection<? extends Number> numbers) {
      return boxed(numbers.stream().mapToDouble(Number::doubleValue).max());
    }
  };

  public abstract Double aggregate(Collection<? extends Number> numbers);

  private static Double boxed(OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }
}
