package io.github.fiserro.homeheat.persistence;

import com.google.common.collect.ImmutableMap;
import io.github.fiserro.homeheat.ufh.OperationMode;
import java.time.Instant;
import java.util.Map;

/**
 * State of a controller that survives a restart. The controller produces it on every tick;
 * storing it is up to the caller.
 */
public record ControllerSnapshot(
    int version,
    Instant savedAt,
    OperationMode mode,
    boolean flushEnabled,
    Map<String, ZoneSnapshot> zones) {

  public static final int CURRENT_VERSION = 1;

  public ControllerSnapshot {
    mode = mode == null ? OperationMode.AUTO : mode;
    zones = zones == null ? ImmutableMap.of() : ImmutableMap.copyOf(zones);
  }
}
