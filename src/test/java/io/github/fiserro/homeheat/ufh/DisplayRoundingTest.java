package io.github.fiserro.homeheat.ufh;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DisplayRoundingTest {

  @Test
  void firstValueIsPlainRounded() {
    assertEquals(20.3, DisplayRounding.round(20.26, null), 1e-9);
  }

  @ParameterizedTest(name = "raw {0} with display {1} shows {2}")
  @CsvSource({
      "20.04, 20.0, 20.0",
      "20.06, 20.0, 20.0",
      "20.07, 20.0, 20.0",
      "20.09, 20.0, 20.1",
      "19.94, 20.0, 20.0",
      "19.93, 20.0, 20.0",
      "19.91, 20.0, 19.9",
      "20.56, 20.0, 20.6",
      "19.40, 20.0, 19.4",
      "20.0, 20.0, 20.0"
  })
  void movesOnlyPastTheMargin(double raw, double previous, double expected) {
    assertEquals(expected, DisplayRounding.round(raw, previous), 1e-9);
  }

  @Test
  void oscillationAroundBoundaryDoesNotFlicker() {
    Double display = DisplayRounding.round(20.04, null);
    for (double raw : new double[] {20.06, 20.04, 20.07, 20.05, 20.06}) {
      display = DisplayRounding.round(raw, display);
      assertEquals(20.0, display, 1e-9);
    }
  }
}
