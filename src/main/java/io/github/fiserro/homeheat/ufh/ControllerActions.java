package io.github.fiserro.homeheat.ufh;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Commands produced by one controller tick, executed by the caller.
 *
 * <p>A zone missing from {@code zoneActions} must not be commanded this tick. A {@code null}
 * heat request or secondary mode means no command for that output.
 */
public record ControllerActions(
    Map<String, ZoneAction> zoneActions,
    Boolean heatRequest,
    SecondaryMode secondaryMode) {

  private static final ControllerActions NONE = new ControllerActions(Map.of(), null, null);

  public ControllerActions {
    zoneActions = zoneActions == null ? ImmutableMap.of() : ImmutableMap.copyOf(zoneActions);
  }

  public static ControllerActions none() {
    return NONE;
  }

  public ZoneAction action(String zoneId) {
    return zoneActions.get(zoneId);
  }

  /** Zone actions that must actually be sent to an actuator. */
  public Map<String, ZoneAction> commands() {
    return zoneActions.entrySet().stream()
        .filter(e -> e.getValue().requiresCommand())
        .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
  }
}
