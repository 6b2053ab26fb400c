package io.github.fiserro.homeheat.ufh;

import java.util.Collection;

/** Aggregates zone health into the health of the whole controller. */
public final class ControllerHealth {

  private ControllerHealth() {
  }

  /**
   * Aggregation rules, first match wins:
   * <ol>
   *   <li>no zones → NORMAL</li>
   *   <li>all INITIALIZING → INITIALIZING</li>
   *   <li>all FAIL_SAFE → FAIL_SAFE</li>
   *   <li>some NORMAL → NORMAL, or DEGRADED if any zone is DEGRADED or FAIL_SAFE</li>
   *   <li>some INITIALIZING → INITIALIZING, or DEGRADED if any zone is DEGRADED or
   *       FAIL_SAFE</li>
   *   <li>otherwise DEGRADED</li>
   * </ol>
   */
  public static ControllerStatus aggregate(Collection<ZoneStatus> statuses) {
    if (statuses.isEmpty()) {
      return ControllerStatus.NORMAL;
    }
    if (statuses.stream().allMatch(s -> s == ZoneStatus.INITIALIZING)) {
      return ControllerStatus.INITIALIZING;
    }
    if (statuses.stream().allMatch(s -> s == ZoneStatus.FAIL_SAFE)) {
      return ControllerStatus.FAIL_SAFE;
    }

    boolean anyImpaired = statuses.stream()
        .anyMatch(s -> s == ZoneStatus.DEGRADED || s == ZoneStatus.FAIL_SAFE);
    if (statuses.contains(ZoneStatus.NORMAL) || statuses.contains(ZoneStatus.INITIALIZING)) {
      if (anyImpaired) {
        return ControllerStatus.DEGRADED;
      }
      return statuses.contains(ZoneStatus.NORMAL)
          ? ControllerStatus.NORMAL
          : ControllerStatus.INITIALIZING;
    }
    return ControllerStatus.DEGRADED;
  }
}
