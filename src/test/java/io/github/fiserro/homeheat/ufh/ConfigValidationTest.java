package io.github.fiserro.homeheat.ufh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Defaults and validation of the configuration records. */
class ConfigValidationTest {

  @Nested
  class Timing {

    @Test
    void defaults() {
      TimingParams timing = TimingParams.defaults();

      assertEquals(7200, timing.observationPeriod());
      assertEquals(540, timing.minRunTime());
      assertEquals(210, timing.valveOpenTime());
      assertEquals(240, timing.closingWarningDuration());
      assertEquals(600, timing.windowBlockTime());
      assertEquals(60, timing.loopInterval());
      assertEquals(480, timing.flushDuration());
    }

    @Test
    void rejectsNonPositiveValues() {
      assertThrows(IllegalArgumentException.class,
          () -> TimingParams.builder().valveOpenTime(0).build());
      assertThrows(IllegalArgumentException.class,
          () -> TimingParams.builder().flushDuration(-1).build());
    }

    @Test
    void rejectsMinRunTimeNotShorterThanPeriod() {
      assertThrows(IllegalArgumentException.class,
          () -> TimingParams.builder().observationPeriod(600).minRunTime(600).build());
    }
  }

  @Nested
  class Zone {

    @Test
    void defaults() {
      ZoneConfig zone = ZoneConfig.builder().id("living").build();

      assertEquals("living", zone.name());
      assertEquals(CircuitType.REGULAR, zone.circuitType());
      assertEquals(16.0, zone.setpointMin());
      assertEquals(21.0, zone.setpointDefault());
      assertEquals(28.0, zone.setpointMax());
      assertEquals(50.0, zone.kp());
      assertEquals(0.001, zone.ki());
      assertEquals(0.0, zone.kd());
      assertEquals(0.0, zone.integralMin());
      assertEquals(100.0, zone.integralMax());
      assertEquals(600, zone.emaTimeConstant());
    }

    @Test
    void rejectsSetpointOutsideRange() {
      assertThrows(IllegalArgumentException.class,
          () -> ZoneConfig.builder().id("living").setpointDefault(30).build());
    }

    @Test
    void rejectsInvertedIntegralBounds() {
      assertThrows(IllegalArgumentException.class,
          () -> ZoneConfig.builder().id("living").integralMin(50).integralMax(10).build());
    }

    @Test
    void rejectsNegativeTimeConstant() {
      assertThrows(IllegalArgumentException.class,
          () -> ZoneConfig.builder().id("living").emaTimeConstant(-1).build());
    }

    @Test
    void requiresId() {
      assertThrows(NullPointerException.class, () -> ZoneConfig.builder().build());
      assertThrows(IllegalArgumentException.class, () -> ZoneConfig.builder().id(" ").build());
    }

    @Test
    void clampsSetpoint() {
      ZoneConfig zone = ZoneConfig.builder().id("living").build();

      assertEquals(16.0, zone.clampSetpoint(5));
      assertEquals(28.0, zone.clampSetpoint(35));
      assertEquals(22.5, zone.clampSetpoint(22.5));
    }

    @Test
    void windowSensorsAreCopied() {
      List<String> sensors = new ArrayList<>(List.of("window.living"));
      ZoneConfig zone = ZoneConfig.builder().id("living").windowSensors(sensors).build();

      sensors.add("door.terrace");

      assertEquals(List.of("window.living"), zone.windowSensors());
    }
  }

  @Nested
  class Controller {

    @Test
    void defaults() {
      ControllerConfig config = ControllerConfig.builder().id("ufh").build();

      assertEquals(0.85, config.valveOpenThreshold());
      assertEquals(120, config.initializingTimeout());
      assertEquals(3600, config.failSafeTimeout());
      assertEquals(3, config.failureWarningThreshold());
      assertEquals(600.0, config.maxDeltaSeconds());
      assertEquals(TimingParams.defaults(), config.timing());
    }

    @Test
    void rejectsDuplicateZoneIds() {
      ZoneConfig zone = ZoneConfig.builder().id("living").build();

      assertThrows(IllegalArgumentException.class,
          () -> ControllerConfig.builder().id("ufh").zones(List.of(zone, zone)).build());
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
      assertThrows(IllegalArgumentException.class,
          () -> ControllerConfig.builder().id("ufh").valveOpenThreshold(1.5).build());
      assertThrows(IllegalArgumentException.class,
          () -> ControllerConfig.builder().id("ufh").valveOpenThreshold(0).build());
    }
  }
}
