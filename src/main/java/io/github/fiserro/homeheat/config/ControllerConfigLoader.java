package io.github.fiserro.homeheat.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fiserro.homeheat.ufh.CircuitType;
import io.github.fiserro.homeheat.ufh.ControllerConfig;
import io.github.fiserro.homeheat.ufh.TimingParams;
import io.github.fiserro.homeheat.ufh.ZoneConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads a {@link ControllerConfig} from JSON.
 *
 * <p>Keys are named after the record components. Every key except the controller and zone
 * {@code id} is optional and falls back to its default; the defaults used are logged per
 * section.
 *
 * <pre>{@code
 * {
 *   "id": "ufh",
 *   "timing": { "observationPeriod": 7200 },
 *   "timeZone": "Europe/Prague",
 *   "zones": [
 *     { "id": "living", "temperatureSensor": "sensor.living", "valveSwitch": "switch.living",
 *       "presets": { "comfort": 22.0 } }
 *   ]
 * }
 * }</pre>
 */
@Slf4j
public class ControllerConfigLoader {

  private final ObjectMapper objectMapper = new ObjectMapper();

  public ControllerConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  public ControllerConfig load(InputStream json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IOException("Controller configuration must be a JSON object");
    }
    return parse(root);
  }

  public ControllerConfig parse(JsonNode root) {
    Section controller = new Section(root, "controller");
    String id = controller.requiredText("id");
    controller.path = "controller " + id;

    ControllerConfig.ControllerConfigBuilder builder = ControllerConfig.builder()
        .id(id)
        .name(controller.text("name", id))
        .timing(timing(root.path("timing"), id))
        .valveOpenThreshold(controller.number("valveOpenThreshold",
            ControllerConfig.DEFAULT_VALVE_OPEN_THRESHOLD))
        .initializingTimeout(controller.integer("initializingTimeout",
            ControllerConfig.DEFAULT_INITIALIZING_TIMEOUT))
        .failSafeTimeout(controller.integer("failSafeTimeout",
            ControllerConfig.DEFAULT_FAIL_SAFE_TIMEOUT))
        .failureWarningThreshold(controller.integer("failureWarningThreshold",
            ControllerConfig.DEFAULT_FAILURE_WARNING_THRESHOLD))
        .maxDeltaSeconds(controller.number("maxDeltaSeconds",
            ControllerConfig.DEFAULT_MAX_DELTA_SECONDS))
        .timeZone(timeZone(controller.text("timeZone", "UTC")));

    List<ZoneConfig> zones = new ArrayList<>();
    JsonNode zonesNode = root.path("zones");
    if (!zonesNode.isMissingNode() && !zonesNode.isArray()) {
      throw new IllegalArgumentException(id + ": zones must be an array");
    }
    for (JsonNode zone : zonesNode) {
      zones.add(zone(zone, id));
    }
    controller.logDefaults();
    return builder.zones(zones).build();
  }

  private TimingParams timing(JsonNode node, String controllerId) {
    Section timing = new Section(node, controllerId + " timing");
    TimingParams params = TimingParams.builder()
        .observationPeriod(timing.integer("observationPeriod",
            TimingParams.DEFAULT_OBSERVATION_PERIOD))
        .minRunTime(timing.integer("minRunTime", TimingParams.DEFAULT_MIN_RUN_TIME))
        .valveOpenTime(timing.integer("valveOpenTime", TimingParams.DEFAULT_VALVE_OPEN_TIME))
        .closingWarningDuration(timing.integer("closingWarningDuration",
            TimingParams.DEFAULT_CLOSING_WARNING_DURATION))
        .windowBlockTime(timing.integer("windowBlockTime",
            TimingParams.DEFAULT_WINDOW_BLOCK_TIME))
        .loopInterval(timing.integer("loopInterval", TimingParams.DEFAULT_LOOP_INTERVAL))
        .flushDuration(timing.integer("flushDuration", TimingParams.DEFAULT_FLUSH_DURATION))
        .build();
    timing.logDefaults();
    return params;
  }

  private ZoneConfig zone(JsonNode node, String controllerId) {
    Section zone = new Section(node, controllerId + " zone");
    String id = zone.requiredText("id");
    zone.path = controllerId + " zone " + id;

    ZoneConfig config = ZoneConfig.builder()
        .id(id)
        .name(zone.text("name", id))
        .temperatureSensor(zone.text("temperatureSensor", null))
        .valveSwitch(zone.text("valveSwitch", null))
        .circuitType(circuitType(zone.text("circuitType", CircuitType.REGULAR.name())))
        .setpointMin(zone.number("setpointMin", ZoneConfig.DEFAULT_SETPOINT_MIN))
        .setpointDefault(zone.number("setpointDefault", ZoneConfig.DEFAULT_SETPOINT))
        .setpointMax(zone.number("setpointMax", ZoneConfig.DEFAULT_SETPOINT_MAX))
        .kp(zone.number("kp", ZoneConfig.DEFAULT_KP))
        .ki(zone.number("ki", ZoneConfig.DEFAULT_KI))
        .kd(zone.number("kd", ZoneConfig.DEFAULT_KD))
        .integralMin(zone.number("integralMin", ZoneConfig.DEFAULT_INTEGRAL_MIN))
        .integralMax(zone.number("integralMax", ZoneConfig.DEFAULT_INTEGRAL_MAX))
        .emaTimeConstant(zone.integer("emaTimeConstant", ZoneConfig.DEFAULT_EMA_TIME_CONSTANT))
        .windowSensors(zone.textList("windowSensors"))
        .presets(zone.numberMap("presets"))
        .build();
    zone.logDefaults();
    return config;
  }

  private static CircuitType circuitType(String value) {
    try {
      return CircuitType.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown circuit type: " + value, e);
    }
  }

  private static ZoneId timeZone(String value) {
    try {
      return ZoneId.of(value);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Unknown time zone: " + value, e);
    }
  }

  /** One JSON object being read, collecting the keys that fell back to defaults. */
  private static final class Section {

    private final JsonNode node;
    private String path;
    private final List<String> defaulted = new ArrayList<>();

    Section(JsonNode node, String path) {
      this.node = node;
      this.path = path;
    }

    String requiredText(String key) {
      JsonNode value = node.get(key);
      if (value == null || !value.isTextual() || value.asText().isBlank()) {
        throw new IllegalArgumentException(path + ": missing required '" + key + "'");
      }
      return value.asText();
    }

    String text(String key, String defaultValue) {
      JsonNode value = value(key);
      if (value == null) {
        if (defaultValue != null) {
          defaulted.add(key);
        }
        return defaultValue;
      }
      if (!value.isTextual()) {
        throw invalid(key, value, "a string");
      }
      return value.asText();
    }

    double number(String key, double defaultValue) {
      JsonNode value = value(key);
      if (value == null) {
        defaulted.add(key);
        return defaultValue;
      }
      if (!value.isNumber()) {
        throw invalid(key, value, "a number");
      }
      return value.asDouble();
    }

    int integer(String key, int defaultValue) {
      JsonNode value = value(key);
      if (value == null) {
        defaulted.add(key);
        return defaultValue;
      }
      if (!value.isIntegralNumber() || !value.canConvertToInt()) {
        throw invalid(key, value, "an integer");
      }
      return value.asInt();
    }

    List<String> textList(String key) {
      JsonNode value = value(key);
      List<String> list = new ArrayList<>();
      if (value == null) {
        return list;
      }
      if (!value.isArray()) {
        throw invalid(key, value, "an array of strings");
      }
      for (JsonNode item : value) {
        if (!item.isTextual()) {
          throw invalid(key, value, "an array of strings");
        }
        list.add(item.asText());
      }
      return list;
    }

    Map<String, Double> numberMap(String key) {
      JsonNode value = value(key);
      Map<String, Double> map = new LinkedHashMap<>();
      if (value == null) {
        return map;
      }
      if (!value.isObject()) {
        throw invalid(key, value, "an object of numbers");
      }
      value.fields().forEachRemaining(entry -> {
        if (!entry.getValue().isNumber()) {
          throw invalid(key + "." + entry.getKey(), entry.getValue(), "a number");
        }
        map.put(entry.getKey(), entry.getValue().asDouble());
      });
      return map;
    }

    void logDefaults() {
      if (!defaulted.isEmpty()) {
        log.info("{}: using defaults for {}", path, defaulted);
      }
    }

    private JsonNode value(String key) {
      JsonNode value = node.get(key);
      return value == null || value.isNull() ? null : value;
    }

    private IllegalArgumentException invalid(String key, JsonNode value, String expected) {
      return new IllegalArgumentException(
          path + ": '" + key + "' must be " + expected + ", got " + value);
    }
  }
}
