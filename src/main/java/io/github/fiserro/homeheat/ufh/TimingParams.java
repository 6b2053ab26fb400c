package io.github.fiserro.homeheat.ufh;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.Builder;

/**
 * Timing constants of the zone scheduler. All values are in seconds.
 *
 * @param observationPeriod accounting window over which each zone's quota is tracked
 * @param minRunTime shortest valve run worth starting
 * @param valveOpenTime time an actuator needs to open; window for open detection
 * @param closingWarningDuration remaining quota below which a zone stops requesting heat
 * @param windowBlockTime lookback for "window recently open"
 * @param loopInterval nominal tick cadence of the caller
 * @param flushDuration post-DHW window during which flush circuits may still run
 */
@Builder(toBuilder = true, builderClassName = "TimingParamsBuilder")
public record TimingParams(
    int observationPeriod,
    int minRunTime,
    int valveOpenTime,
    int closingWarningDuration,
    int windowBlockTime,
    int loopInterval,
    int flushDuration) {

  public static final int DEFAULT_OBSERVATION_PERIOD = 7200;
  public static final int DEFAULT_MIN_RUN_TIME = 540;
  public static final int DEFAULT_VALVE_OPEN_TIME = 210;
  public static final int DEFAULT_CLOSING_WARNING_DURATION = 240;
  public static final int DEFAULT_WINDOW_BLOCK_TIME = 600;
  public static final int DEFAULT_LOOP_INTERVAL = 60;
  public static final int DEFAULT_FLUSH_DURATION = 480;

  public TimingParams {
    checkArgument(observationPeriod > 0, "observationPeriod must be positive: %s", observationPeriod);
    checkArgument(minRunTime > 0, "minRunTime must be positive: %s", minRunTime);
    checkArgument(valveOpenTime > 0, "valveOpenTime must be positive: %s", valveOpenTime);
    checkArgument(closingWarningDuration > 0,
        "closingWarningDuration must be positive: %s", closingWarningDuration);
    checkArgument(windowBlockTime > 0, "windowBlockTime must be positive: %s", windowBlockTime);
    checkArgument(loopInterval > 0, "loopInterval must be positive: %s", loopInterval);
    checkArgument(flushDuration > 0, "flushDuration must be positive: %s", flushDuration);
    checkArgument(minRunTime < observationPeriod,
        "minRunTime (%s) must be shorter than observationPeriod (%s)", minRunTime, observationPeriod);
  }

  public static TimingParams defaults() {
    return builder().build();
  }

  public static class TimingParamsBuilder {
    public TimingParamsBuilder() {
      observationPeriod = DEFAULT_OBSERVATION_PERIOD;
      minRunTime = DEFAULT_MIN_RUN_TIME;
      valveOpenTime = DEFAULT_VALVE_OPEN_TIME;
      closingWarningDuration = DEFAULT_CLOSING_WARNING_DURATION;
      windowBlockTime = DEFAULT_WINDOW_BLOCK_TIME;
      loopInterval = DEFAULT_LOOP_INTERVAL;
      flushDuration = DEFAULT_FLUSH_DURATION;
    }
  }
}
