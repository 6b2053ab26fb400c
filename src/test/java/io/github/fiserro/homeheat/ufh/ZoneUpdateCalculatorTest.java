package io.github.fiserro.homeheat.ufh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the per-zone calculator chain. */
class ZoneUpdateCalculatorTest {

  private static final ZoneConfig CONFIG = ZoneConfig.builder().id("living").build();
  private static final ZoneHistory QUIET = new ZoneHistory(0.25, 0.0, false);

  private final ZoneUpdateCalculator calculator = new ZoneUpdateCalculator();

  private ZoneUpdate update(ZoneState state, Double temperature, ZoneHistory history) {
    return ZoneUpdate.builder()
        .config(CONFIG)
        .regulator(PidRegulator.of(CONFIG))
        .timing(TimingParams.defaults())
        .reading(ZoneReading.builder().temperature(temperature).valveState(ValveState.OFF)
            .build())
        .history(history)
        .tickDelta(60)
        .sampleDelta(60)
        .periodElapsed(1800)
        .state(state)
        .build();
  }

  @Test
  void firstReadingProducesDutyCycleAndQuota() {
    ZoneState state = calculator.calculate(update(ZoneState.initial(CONFIG), 20.0, QUIET))
        .state();

    assertEquals(20.0, state.temperature());
    assertEquals(20.0, state.displayTemperature());
    assertEquals(50.06, state.dutyCycle(), 1e-9);
    assertEquals(50.06 / 100 * 7200, state.requestedDuration(), 1e-9);
    assertEquals(0.25 * 1800, state.usedDuration(), 1e-9);
    assertEquals(0.25, state.periodStateAvg());
    assertFalse(state.quotaStale());
  }

  @Test
  void temperatureIsSmoothedBeforeControl() {
    ZoneState previous = ZoneState.initial(CONFIG).withTemperature(20.0)
        .withDisplayTemperature(20.0);

    ZoneState state = calculator.calculate(update(previous, 26.6, QUIET)).state();

    // alpha = 60 / 660
    double filtered = 20.0 + 6.6 * 60 / 660;
    assertEquals(filtered, state.temperature(), 1e-9);
    assertEquals(50 * (21.0 - filtered) + 0.001 * (21.0 - filtered) * 60,
        state.pid().dutyCycle(), 1e-9);
  }

  @Test
  void usesRegulatorCarriedByUpdate() {
    PidRegulator proportionalOnly = new PidRegulator(10, 0, 0, 0, 100);

    ZoneState state = calculator.calculate(update(ZoneState.initial(CONFIG), 20.0, QUIET)
        .withRegulator(proportionalOnly)).state();

    assertEquals(10.0, state.dutyCycle(), 1e-9);
  }

  @Test
  void sampleAtSameInstantKeepsFilteredTemperature() {
    ZoneState previous = ZoneState.initial(CONFIG).withTemperature(20.0)
        .withDisplayTemperature(20.0);

    ZoneState state = calculator.calculate(update(previous, 26.6, QUIET).withSampleDelta(0))
        .state();

    assertEquals(20.0, state.temperature());
    assertEquals(20.0, state.displayTemperature());
  }

  @Nested
  class PidPaused {

    private final PidState prior = new PidState(1.0, 50, 10, 0, 60);
    private final ZoneState running = ZoneState.initial(CONFIG).withTemperature(20.0)
        .withPid(prior);

    @Test
    void withoutTemperature() {
      ZoneState state = calculator.calculate(update(running, null, QUIET)).state();

      assertSame(prior, state.pid());
      assertEquals(20.0, state.temperature());
    }

    @Test
    void whenZoneDisabled() {
      ZoneState state = calculator.calculate(update(running.withEnabled(false), 20.0, QUIET))
          .state();

      assertSame(prior, state.pid());
    }

    @Test
    void whileWindowRecentlyOpen() {
      ZoneHistory windowOpen = new ZoneHistory(0.25, 0.0, true);

      ZoneState state = calculator.calculate(update(running, 18.0, windowOpen)).state();

      assertSame(prior, state.pid());
      assertTrue(state.windowRecentlyOpen());
      assertEquals(60 / 100.0 * 7200, state.requestedDuration(), 1e-9);
    }

    @Test
    void zoneWithoutDataKeepsNoDutyCycle() {
      ZoneState state = calculator.calculate(update(ZoneState.initial(CONFIG), null, QUIET))
          .state();

      assertNull(state.pid());
      assertEquals(0.0, state.requestedDuration());
    }
  }

  @Test
  void failedPeriodQueryMarksQuotaStale() {
    ZoneState previous = ZoneState.initial(CONFIG).toBuilder()
        .temperature(20.0)
        .requestedDuration(3000)
        .usedDuration(1000)
        .build();
    ZoneHistory failed = new ZoneHistory(null, 1.0, false);

    ZoneState state = calculator.calculate(update(previous, 20.0, failed)).state();

    assertTrue(state.quotaStale());
    assertEquals(3000, state.requestedDuration());
    assertEquals(1000, state.usedDuration());
    assertEquals(1.0, state.openStateAvg());
  }
}
