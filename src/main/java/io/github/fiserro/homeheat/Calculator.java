package io.github.fiserro.homeheat;

import java.util.function.Function;

/**
 * Generic calculator interface for one step of a control pipeline.
 * Extends Function to allow use in functional pipelines.
 *
 * <p>Implementations must be pure: the returned value depends only on the given state.
 *
 * @param <T> the immutable state type flowing through the pipeline
 */
public interface Calculator<T> extends Function<T, T> {

  T calculate(T state);

  @Override
  default T apply(T state) {
    return calculate(state);
  }
}
