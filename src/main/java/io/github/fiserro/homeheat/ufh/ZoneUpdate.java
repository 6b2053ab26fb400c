package io.github.fiserro.homeheat.ufh;

import lombok.Builder;
import lombok.With;

/**
 * Everything one zone needs for one tick, flowing through the {@link ZoneUpdateCalculator}
 * chain. Only {@code state} is changed by the calculators.
 *
 * @param regulator the zone's PID regulator
 * @param tickDelta seconds since the previous tick, used by the PID regulator
 * @param sampleDelta seconds since this zone's previous temperature sample, used by the filter
 * @param periodElapsed seconds elapsed in the current observation period
 */
@With
@Builder
public record ZoneUpdate(
    ZoneConfig config,
    PidRegulator regulator,
    TimingParams timing,
    ZoneReading reading,
    ZoneHistory history,
    double tickDelta,
    double sampleDelta,
    double periodElapsed,
    ZoneState state) {}
