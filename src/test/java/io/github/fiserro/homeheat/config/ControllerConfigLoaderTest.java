package io.github.fiserro.homeheat.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.fiserro.homeheat.ufh.CircuitType;
import io.github.fiserro.homeheat.ufh.ControllerConfig;
import io.github.fiserro.homeheat.ufh.TimingParams;
import io.github.fiserro.homeheat.ufh.ZoneConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ControllerConfigLoaderTest {

  private final ControllerConfigLoader loader = new ControllerConfigLoader();

  private ControllerConfig load(String json) throws IOException {
    return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Nested
  class FromResource {

    private ControllerConfig config() throws IOException {
      try (InputStream in = getClass().getResourceAsStream("/controller-config.json")) {
        return loader.load(in);
      }
    }

    @Test
    void readsControllerSettings() throws IOException {
      ControllerConfig config = config();

      assertEquals("ufh", config.id());
      assertEquals("Underfloor heating", config.name());
      assertEquals(ZoneId.of("Europe/Prague"), config.timeZone());
      assertEquals(1800, config.failSafeTimeout());
      assertEquals(ControllerConfig.DEFAULT_INITIALIZING_TIMEOUT, config.initializingTimeout());
      assertEquals(ControllerConfig.DEFAULT_VALVE_OPEN_THRESHOLD, config.valveOpenThreshold());
    }

    @Test
    void mergesTimingWithDefaults() throws IOException {
      TimingParams timing = config().timing();

      assertEquals(3600, timing.observationPeriod());
      assertEquals(300, timing.minRunTime());
      assertEquals(TimingParams.DEFAULT_VALVE_OPEN_TIME, timing.valveOpenTime());
      assertEquals(TimingParams.DEFAULT_FLUSH_DURATION, timing.flushDuration());
    }

    @Test
    void readsZonesInOrder() throws IOException {
      List<ZoneConfig> zones = config().zones();

      assertEquals(2, zones.size());
      ZoneConfig living = zones.get(0);
      assertEquals("living", living.id());
      assertEquals("Living room", living.name());
      assertEquals("switch.living_valve", living.valveSwitch());
      assertEquals(CircuitType.REGULAR, living.circuitType());
      assertEquals(22.0, living.setpointDefault());
      assertEquals(40.0, living.kp());
      assertEquals(ZoneConfig.DEFAULT_KI, living.ki());
      assertEquals(List.of("binary_sensor.living_window", "binary_sensor.terrace_door"),
          living.windowSensors());
      assertEquals(Map.of("comfort", 22.5, "eco", 19.0), living.presets());

      ZoneConfig bathroom = zones.get(1);
      assertEquals("bathroom", bathroom.name());
      assertEquals(CircuitType.FLUSH, bathroom.circuitType());
      assertTrue(bathroom.windowSensors().isEmpty());
    }
  }

  @Test
  void minimalDocumentUsesDefaults() throws IOException {
    ControllerConfig config = load("{\"id\": \"ufh\"}");

    assertEquals("ufh", config.name());
    assertEquals(TimingParams.defaults(), config.timing());
    assertEquals(ZoneId.of("UTC"), config.timeZone());
    assertTrue(config.zones().isEmpty());
  }

  @Test
  void zoneWithoutSensorsKeepsThemUnset() throws IOException {
    ZoneConfig zone = load("{\"id\": \"ufh\", \"zones\": [{\"id\": \"hall\"}]}").zones().get(0);

    assertNull(zone.temperatureSensor());
    assertEquals(ZoneConfig.DEFAULT_EMA_TIME_CONSTANT, zone.emaTimeConstant());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "{}",
      "{\"id\": \"ufh\", \"zones\": [{\"name\": \"no id\"}]}",
      "{\"id\": \"ufh\", \"failSafeTimeout\": \"long\"}",
      "{\"id\": \"ufh\", \"failSafeTimeout\": 12.5}",
      "{\"id\": \"ufh\", \"timeZone\": \"Mars/Olympus\"}",
      "{\"id\": \"ufh\", \"zones\": {\"id\": \"hall\"}}",
      "{\"id\": \"ufh\", \"zones\": [{\"id\": \"hall\", \"circuitType\": \"radiator\"}]}",
      "{\"id\": \"ufh\", \"zones\": [{\"id\": \"hall\", \"presets\": {\"eco\": \"cold\"}}]}",
      "{\"id\": \"ufh\", \"zones\": [{\"id\": \"hall\"}, {\"id\": \"hall\"}]}",
      "{\"id\": \"ufh\", \"zones\": [{\"id\": \"hall\", \"setpointMin\": 25}]}",
      "{\"id\": \"ufh\", \"timing\": {\"observationPeriod\": 300}}"
  })
  void invalidValuesAreRejected(String json) {
    assertThrows(IllegalArgumentException.class, () -> load(json));
  }

  @Test
  void nonObjectDocumentIsUnreadable() {
    assertThrows(IOException.class, () -> load("[1, 2]"));
  }
}
