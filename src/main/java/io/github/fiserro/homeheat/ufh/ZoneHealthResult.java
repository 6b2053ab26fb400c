package io.github.fiserro.homeheat.ufh;

/**
 * Outcome of one {@link ZoneHealthMonitor} update.
 *
 * @param timeoutUsed seconds of failure tolerated in the status the zone was in
 */
public record ZoneHealthResult(ZoneState state, ZoneStatusTransition transition, int timeoutUsed) {}
