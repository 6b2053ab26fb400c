package io.github.fiserro.homeheat;

import java.util.Collection;

/**
 * Aggregation of boolean flags, e.g. the per-zone heat requests that are combined into the
 * single boiler request.
 *
 * <p>An empty collection yields {@code false}.
 */
public enum BooleanAggregation {
  OR;

  public boolean aggregate(Collection<Boolean> values) {
    return values.stream().anyMatch(Boolean.TRUE::equals);
  }
}
