package io.github.fiserro.homeheat.ufh;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Configuration of a heating controller and its zones.
 *
 * <p>Zone order is significant: CYCLE mode activates zones in this order.
 *
 * @param valveOpenThreshold recent open-state average above which a valve counts as physically
 *     open
 * @param initializingTimeout seconds a zone that never came up may fail before FAIL_SAFE
 * @param failSafeTimeout seconds without success before an established zone enters FAIL_SAFE
 * @param failureWarningThreshold consecutive failures after which a warning is logged
 * @param maxDeltaSeconds upper bound applied to every tick delta
 * @param timeZone zone used for observation period alignment and the CYCLE hour
 */
@Builder(toBuilder = true, builderClassName = "ControllerConfigBuilder")
public record ControllerConfig(
    String id,
    String name,
    TimingParams timing,
    List<ZoneConfig> zones,
    double valveOpenThreshold,
    int initializingTimeout,
    int failSafeTimeout,
    int failureWarningThreshold,
    double maxDeltaSeconds,
    ZoneId timeZone) {

  public static final double DEFAULT_VALVE_OPEN_THRESHOLD = 0.85;
  public static final int DEFAULT_INITIALIZING_TIMEOUT = 120;
  public static final int DEFAULT_FAIL_SAFE_TIMEOUT = 3600;
  public static final int DEFAULT_FAILURE_WARNING_THRESHOLD = 3;
  public static final double DEFAULT_MAX_DELTA_SECONDS = 600;

  public ControllerConfig {
    checkNotNull(id, "id");
    checkNotNull(timing, "timing");
    checkNotNull(timeZone, "timeZone");
    name = name == null ? id : name;
    zones = zones == null ? ImmutableList.of() : ImmutableList.copyOf(zones);
    Set<String> ids = new HashSet<>();
    for (ZoneConfig zone : zones) {
      checkArgument(ids.add(zone.id()), "duplicate zone id: %s", zone.id());
    }
    checkArgument(valveOpenThreshold > 0 && valveOpenThreshold <= 1,
        "valveOpenThreshold must be in (0, 1]: %s", valveOpenThreshold);
    checkArgument(initializingTimeout > 0,
        "initializingTimeout must be positive: %s", initializingTimeout);
    checkArgument(failSafeTimeout > 0, "failSafeTimeout must be positive: %s", failSafeTimeout);
    checkArgument(failureWarningThreshold > 0,
        "failureWarningThreshold must be positive: %s", failureWarningThreshold);
    checkArgument(maxDeltaSeconds > 0, "maxDeltaSeconds must be positive: %s", maxDeltaSeconds);
  }

  public static class ControllerConfigBuilder {
    public ControllerConfigBuilder() {
      timing = TimingParams.defaults();
      zones = List.of();
      valveOpenThreshold = DEFAULT_VALVE_OPEN_THRESHOLD;
      initializingTimeout = DEFAULT_INITIALIZING_TIMEOUT;
      failSafeTimeout = DEFAULT_FAIL_SAFE_TIMEOUT;
      failureWarningThreshold = DEFAULT_FAILURE_WARNING_THRESHOLD;
      maxDeltaSeconds = DEFAULT_MAX_DELTA_SECONDS;
      timeZone = ZoneId.of("UTC");
    }
  }
}
