package io.github.fiserro.homeheat.ufh;

/**
 * Controller-wide health rolled up from all zones by {@link ControllerHealth}.
 *
 * <p>{@link #FAIL_SAFE} means every zone has lost its inputs: all valves are forced closed and
 * the boiler is released to its own fallback.
 */
public enum ControllerStatus {
  INITIALIZING,
  NORMAL,
  DEGRADED,
  FAIL_SAFE
}
