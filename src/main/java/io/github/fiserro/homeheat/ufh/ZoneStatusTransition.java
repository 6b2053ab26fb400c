package io.github.fiserro.homeheat.ufh;

/** Status change caused by one health update. */
public enum ZoneStatusTransition {
  NONE,
  INITIALIZED,
  ENTERED_DEGRADED,
  ENTERED_FAIL_SAFE,
  RECOVERED
}
