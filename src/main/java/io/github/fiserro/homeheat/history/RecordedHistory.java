package io.github.fiserro.homeheat.history;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory {@link HistorySource} built from recorded state changes.
 *
 * <p>The state in force at {@code start} is the last change at or before it; an entity with no
 * earlier change is off. Entities marked unavailable fail every query.
 */
@Slf4j
public class RecordedHistory implements HistorySource {

  private final Map<String, NavigableMap<Instant, Boolean>> changes = new HashMap<>();
  private final Set<String> unavailable = new HashSet<>();

  /** Records that {@code entity} switched to {@code on} at {@code at}. */
  public RecordedHistory record(String entity, Instant at, boolean on) {
    changes.computeIfAbsent(entity, e -> new TreeMap<>()).put(at, on);
    return this;
  }

  public RecordedHistory unavailable(String entity, boolean value) {
    if (value) {
      unavailable.add(entity);
    } else {
      unavailable.remove(entity);
    }
    return this;
  }

  /** Drops all changes recorded before {@code cutoff} except the one in force at it. */
  public void prune(Instant cutoff) {
    for (NavigableMap<Instant, Boolean> entity : changes.values()) {
      Instant inForce = entity.floorKey(cutoff);
      if (inForce != null) {
        entity.headMap(inForce, false).clear();
      }
    }
  }

  @Override
  public double stateAverage(String entity, Instant start, Instant end)
      throws HistoryQueryException {
    if (entity == null || unavailable.contains(entity)) {
      throw new HistoryQueryException("history unavailable for " + entity);
    }
    if (!start.isBefore(end)) {
      return 0.0;
    }

    NavigableMap<Instant, Boolean> entityChanges = changes.getOrDefault(entity, new TreeMap<>());
    Map.Entry<Instant, Boolean> initial = entityChanges.floorEntry(start);
    boolean on = initial != null && initial.getValue();
    Instant cursor = start;
    long onMillis = 0;

    for (Map.Entry<Instant, Boolean> change
        : entityChanges.subMap(start, false, end, false).entrySet()) {
      if (on) {
        onMillis += Duration.between(cursor, change.getKey()).toMillis();
      }
      cursor = change.getKey();
      on = change.getValue();
    }
    if (on) {
      onMillis += Duration.between(cursor, end).toMillis();
    }

    double average = (double) onMillis / Duration.between(start, end).toMillis();
    log.trace("{} on for {} of [{}, {})", entity, average, start, end);
    return average;
  }
}
