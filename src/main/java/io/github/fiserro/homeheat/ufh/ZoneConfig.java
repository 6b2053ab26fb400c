package io.github.fiserro.homeheat.ufh;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Static configuration of one heating zone.
 *
 * <p>Sensor and actuator references are opaque handles understood by the caller and by the
 * {@link io.github.fiserro.homeheat.history.HistorySource}; the controller never resolves them.
 *
 * <p>The integral bounds are in duty-cycle percent: the PID accumulator is the integral term
 * itself, so {@code ki} is tuned in percent per degree-second.
 */
@Builder(toBuilder = true, builderClassName = "ZoneConfigBuilder")
public record ZoneConfig(
    String id,
    String name,
    String temperatureSensor,
    String valveSwitch,
    CircuitType circuitType,
    double setpointMin,
    double setpointDefault,
    double setpointMax,
    double kp,
    double ki,
    double kd,
    double integralMin,
    double integralMax,
    int emaTimeConstant,
    List<String> windowSensors,
    Map<String, Double> presets) {

  public static final double DEFAULT_SETPOINT_MIN = 16.0;
  public static final double DEFAULT_SETPOINT = 21.0;
  public static final double DEFAULT_SETPOINT_MAX = 28.0;
  public static final double DEFAULT_KP = 50.0;
  public static final double DEFAULT_KI = 0.001;
  public static final double DEFAULT_KD = 0.0;
  public static final double DEFAULT_INTEGRAL_MIN = 0.0;
  public static final double DEFAULT_INTEGRAL_MAX = 100.0;
  public static final int DEFAULT_EMA_TIME_CONSTANT = 600;

  public ZoneConfig {
    checkNotNull(id, "id");
    checkArgument(!id.isBlank(), "zone id must not be blank");
    checkNotNull(circuitType, "circuitType");
    name = name == null ? id : name;
    checkArgument(setpointMin <= setpointDefault && setpointDefault <= setpointMax,
        "zone %s: setpoints must satisfy min (%s) <= default (%s) <= max (%s)",
        id, setpointMin, setpointDefault, setpointMax);
    checkArgument(integralMin <= integralMax,
        "zone %s: integralMin (%s) must not exceed integralMax (%s)", id, integralMin, integralMax);
    checkArgument(emaTimeConstant >= 0,
        "zone %s: emaTimeConstant must not be negative: %s", id, emaTimeConstant);
    windowSensors = windowSensors == null ? ImmutableList.of() : ImmutableList.copyOf(windowSensors);
    presets = presets == null ? ImmutableMap.of() : ImmutableMap.copyOf(presets);
  }

  /** Clamps a requested setpoint into {@code [setpointMin, setpointMax]}. */
  public double clampSetpoint(double setpoint) {
    return Math.max(setpointMin, Math.min(setpointMax, setpoint));
  }

  public static class ZoneConfigBuilder {
    public ZoneConfigBuilder() {
      circuitType = CircuitType.REGULAR;
      setpointMin = DEFAULT_SETPOINT_MIN;
      setpointDefault = DEFAULT_SETPOINT;
      setpointMax = DEFAULT_SETPOINT_MAX;
      kp = DEFAULT_KP;
      ki = DEFAULT_KI;
      kd = DEFAULT_KD;
      integralMin = DEFAULT_INTEGRAL_MIN;
      integralMax = DEFAULT_INTEGRAL_MAX;
      emaTimeConstant = DEFAULT_EMA_TIME_CONSTANT;
      windowSensors = List.of();
      presets = Map.of();
    }
  }
}
