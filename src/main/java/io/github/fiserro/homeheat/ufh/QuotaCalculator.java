package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.Calculator;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts the duty cycle and valve history into the zone's quota for the current
 * observation period.
 *
 * <p>The requested duration always refers to the full period while the used duration grows
 * with the time elapsed in it:
 * <pre>{@code
 *    requested = dutyCycle / 100 * observationPeriod
 *    used      = periodStateAvg * periodElapsed
 * }</pre>
 *
 * <p>When the period query failed the previous durations are kept and the quota is marked
 * stale; the zone is then not scheduled this tick.
 */
@Slf4j
public class QuotaCalculator implements Calculator<ZoneUpdate> {

  @Override
  public ZoneUpdate calculate(ZoneUpdate update) {
    ZoneHistory history = update.history();
    ZoneState state = update.state()
        .withOpenStateAvg(history.openStateAvg())
        .withWindowRecentlyOpen(history.windowRecentlyOpen());

    if (history.periodFailed()) {
      log.debug("Zone {}: period history unavailable, quota stale", update.config().id());
      return update.withState(state.withQuotaStale(true));
    }

    int period = update.timing().observationPeriod();
    double requested = ZoneScheduler.requestedDuration(state.dutyCycle(), period);
    double used = ZoneScheduler.usedDuration(
        history.periodStateAvg(), update.periodElapsed(), period);

    log.debug("Zone {}: requested={}s, used={}s (avg={}, elapsed={}s)", update.config().id(),
        requested, used, history.periodStateAvg(), update.periodElapsed());
    return update.withState(state
        .withPeriodStateAvg(history.periodStateAvg())
        .withRequestedDuration(requested)
        .withUsedDuration(used)
        .withQuotaStale(false));
  }
}
