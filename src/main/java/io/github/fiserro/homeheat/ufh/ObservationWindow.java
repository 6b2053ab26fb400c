package io.github.fiserro.homeheat.ufh;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/** Alignment of observation periods to local midnight. */
public final class ObservationWindow {

  private ObservationWindow() {
  }

  /**
   * Start of the observation period containing {@code now}. Periods are laid out from local
   * midnight in {@code timeZone}; a period that does not divide the day ends at the next
   * midnight.
   */
  public static Instant start(Instant now, int observationPeriod, ZoneId timeZone) {
    ZonedDateTime midnight = now.atZone(timeZone).truncatedTo(ChronoUnit.DAYS);
    long sinceMidnight = Duration.between(midnight.toInstant(), now).getSeconds();
    long periods = sinceMidnight / observationPeriod;
    return midnight.toInstant().plusSeconds(periods * observationPeriod);
  }

  /** Seconds from the period start to {@code now}. */
  public static double elapsed(Instant start, Instant now) {
    return Duration.between(start, now).toMillis() / 1000.0;
  }
}
