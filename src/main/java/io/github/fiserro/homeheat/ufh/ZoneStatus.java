package io.github.fiserro.homeheat.ufh;

/** Health of a single zone, see {@link ZoneHealthMonitor}. */
public enum ZoneStatus {
  INITIALIZING,
  NORMAL,
  DEGRADED,
  FAIL_SAFE
}
