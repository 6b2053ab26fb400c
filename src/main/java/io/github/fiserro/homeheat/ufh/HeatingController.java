package io.github.fiserro.homeheat.ufh;

import com.google.common.collect.ImmutableList;
import io.github.fiserro.homeheat.history.HistorySource;
import io.github.fiserro.homeheat.persistence.ControllerSnapshot;
import io.github.fiserro.homeheat.persistence.ZoneSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Underfloor heating controller: one boiler, many zones.
 *
 * <p>The controller owns no clock and performs no I/O besides history queries. The caller
 * invokes {@link #tick(TickInput)} periodically, executes the returned
 * {@link ControllerActions} and stores the returned snapshot. Calls must not overlap.
 *
 * <p>One tick:
 * <ol>
 *   <li>cap the delta, align the observation period, track the end of DHW heating</li>
 *   <li>per zone: read history, run the {@link ZoneUpdateCalculator} chain, update health</li>
 *   <li>aggregate controller health</li>
 *   <li>evaluate the operation mode in {@link ModeEngine}</li>
 * </ol>
 */
@Slf4j
public class HeatingController {

  private final HistorySource history;
  private final ZoneUpdateCalculator calculator = new ZoneUpdateCalculator();
  private final ControllerState state = new ControllerState();

  @Getter
  @Accessors(fluent = true)
  private ControllerConfig config;
  private ZoneHistoryReader historyReader;
  private ZoneHealthMonitor healthMonitor;
  private ModeEngine modeEngine;
  private Map<String, ZoneRuntime> zones;
  private Instant lastTick;

  public HeatingController(ControllerConfig config, HistorySource history) {
    this.history = history;
    configure(config);
    log.info("Controller {} created with {} zones", config.id(), zones.size());
  }

  public TickResult tick(TickInput input) {
    Instant now = input.now();
    double dt = input.dtSeconds();
    if (dt > config.maxDeltaSeconds()) {
      log.warn("Tick delta {}s exceeds {}s, capping", dt, config.maxDeltaSeconds());
      dt = config.maxDeltaSeconds();
    }

    updateObservationPeriod(now);
    updateDhw(input.dhwActive(), now);

    List<ZoneStatus> statuses = new ArrayList<>();
    for (ZoneRuntime zone : zones.values()) {
      updateZone(zone, input.reading(zone.id()), now, dt);
      statuses.add(zone.state().zoneStatus());
    }

    ControllerStatus status = ControllerHealth.aggregate(statuses);
    if (status != state.status()) {
      log.info("Controller {} status {} -> {}", config.id(), state.status(), status);
      state.status(status);
    }

    ControllerActions actions = modeEngine.evaluate(state, zoneList(), now);
    lastTick = now;
    return new TickResult(actions, status, snapshot(now));
  }

  private void updateObservationPeriod(Instant now) {
    Instant start = ObservationWindow.start(now, config.timing().observationPeriod(),
        config.timeZone());
    if (!start.equals(state.observationStart())) {
      log.info("Observation period started at {}", start);
      state.observationStart(start);
    }
    state.periodElapsed(ObservationWindow.elapsed(start, now));
  }

  private void updateDhw(boolean dhwActive, Instant now) {
    if (state.dhwActive() && !dhwActive) {
      Instant until = now.plusSeconds(config.timing().flushDuration());
      log.info("DHW heating finished, flush window open until {}", until);
      state.flushUntil(until);
    }
    state.dhwActive(dhwActive);
  }

  private void updateZone(ZoneRuntime zone, ZoneReading reading, Instant now, double dt) {
    ZoneHistory zoneHistory = historyReader.read(zone.config(), reading,
        state.observationStart(), now);

    ZoneUpdate update = ZoneUpdate.builder()
        .config(zone.config())
        .regulator(zone.regulator())
        .timing(config.timing())
        .reading(reading)
        .history(zoneHistory)
        .tickDelta(dt)
        .sampleDelta(zone.sampleDelta(now, dt, config.maxDeltaSeconds()))
        .periodElapsed(state.periodElapsed())
        .state(zone.state().withValveState(reading.valveState()))
        .build();
    ZoneState calculated = calculator.apply(update).state();
    if (reading.temperature() != null) {
      zone.lastSampleAt(now);
    }

    ZoneHealthResult health = healthMonitor.update(zone.id(), calculated, now,
        reading.temperature() == null, zoneHistory.periodFailed(),
        reading.valveState() == ValveState.UNAVAILABLE);
    zone.state(health.state());
  }

  public void setMode(OperationMode mode) {
    if (mode != state.mode()) {
      log.info("Controller {} mode {} -> {}", config.id(), state.mode(), mode);
      state.mode(mode);
    }
  }

  public OperationMode mode() {
    return state.mode();
  }

  public void setFlushEnabled(boolean enabled) {
    if (enabled != state.flushEnabled()) {
      log.info("Controller {} flushing {}", config.id(), enabled ? "enabled" : "disabled");
      state.flushEnabled(enabled);
    }
  }

  public boolean flushEnabled() {
    return state.flushEnabled();
  }

  public boolean flushRequest() {
    return state.flushRequest();
  }

  public ControllerStatus status() {
    return state.status();
  }

  /** Sets the setpoint clamped to the zone's range and clears its preset. */
  public boolean setZoneSetpoint(String zoneId, double setpoint) {
    return updateZoneState(zoneId, zone -> {
      double clamped = zone.config().clampSetpoint(setpoint);
      if (clamped != setpoint) {
        log.info("Zone {}: setpoint {} clamped to {}", zoneId, setpoint, clamped);
      }
      return zone.state().withSetpoint(clamped).withPresetMode(null);
    });
  }

  /** Applies a named preset of the zone; fails for an unknown zone or preset. */
  public boolean setZonePreset(String zoneId, String preset) {
    ZoneRuntime zone = zones.get(zoneId);
    if (zone == null) {
      return false;
    }
    Double setpoint = zone.config().presets().get(preset);
    if (setpoint == null) {
      log.warn("Zone {}: unknown preset {}", zoneId, preset);
      return false;
    }
    return updateZoneState(zoneId, z -> z.state()
        .withSetpoint(z.config().clampSetpoint(setpoint))
        .withPresetMode(preset));
  }

  public boolean setZoneEnabled(String zoneId, boolean enabled) {
    return updateZoneState(zoneId, zone -> {
      log.info("Zone {} {}", zoneId, enabled ? "enabled" : "disabled");
      return zone.state().withEnabled(enabled);
    });
  }

  private boolean updateZoneState(String zoneId, Function<ZoneRuntime, ZoneState> change) {
    ZoneRuntime zone = zones.get(zoneId);
    if (zone == null) {
      log.warn("Unknown zone {}", zoneId);
      return false;
    }
    zone.state(change.apply(zone));
    return true;
  }

  public Optional<ZoneState> zone(String zoneId) {
    return Optional.ofNullable(zones.get(zoneId)).map(ZoneRuntime::state);
  }

  public List<String> zoneIds() {
    return ImmutableList.copyOf(zones.keySet());
  }

  public Map<String, Boolean> heatRequests() {
    return Map.copyOf(state.heatRequests());
  }

  public ControllerSnapshot snapshot(Instant savedAt) {
    Map<String, ZoneSnapshot> zoneSnapshots = new LinkedHashMap<>();
    zones.forEach((id, zone) -> zoneSnapshots.put(id, ZoneSnapshot.of(zone.state())));
    return new ControllerSnapshot(ControllerSnapshot.CURRENT_VERSION, savedAt, state.mode(),
        state.flushEnabled(), zoneSnapshots);
  }

  /**
   * Restores persisted state. A zone keeps a PID state it already calculated and its
   * temperatures once it has a reading; zones unknown to this controller are skipped.
   */
  public void restore(ControllerSnapshot snapshot) {
    log.info("Restoring controller {} from snapshot saved at {}", config.id(),
        snapshot.savedAt());
    setMode(snapshot.mode());
    setFlushEnabled(snapshot.flushEnabled());

    snapshot.zones().forEach((id, saved) -> {
      ZoneRuntime zone = zones.get(id);
      if (zone == null) {
        log.debug("Snapshot zone {} not configured, skipping", id);
        return;
      }
      zone.restorePid(saved.pid());
      ZoneState current = zone.state();
      ZoneState restored = current
          .withSetpoint(zone.config().clampSetpoint(saved.setpoint()))
          .withEnabled(saved.enabled())
          .withPresetMode(saved.presetMode());
      if (current.temperature() == null) {
        restored = restored
            .withTemperature(saved.temperature())
            .withDisplayTemperature(saved.displayTemperature());
      }
      zone.state(restored);
    });
  }

  /**
   * Replaces the configuration and rebuilds all zones. State of zones that are still
   * configured carries over the same way as a {@link #restore}.
   */
  public void reconfigure(ControllerConfig newConfig) {
    ControllerSnapshot carried = snapshot(lastTick);
    log.info("Reconfiguring controller {}: {} -> {} zones", newConfig.id(), zones.size(),
        newConfig.zones().size());
    configure(newConfig);
    state.heatRequests().clear();
    state.lastHeatRequest(null);
    state.lastSecondaryMode(null);
    state.status(ControllerStatus.INITIALIZING);
    restore(carried);
  }

  private void configure(ControllerConfig newConfig) {
    this.config = newConfig;
    this.historyReader = new ZoneHistoryReader(history, newConfig.timing());
    this.healthMonitor = ZoneHealthMonitor.of(newConfig);
    this.modeEngine = new ModeEngine(newConfig);
    Map<String, ZoneRuntime> runtimes = new LinkedHashMap<>();
    for (ZoneConfig zone : newConfig.zones()) {
      runtimes.put(zone.id(), new ZoneRuntime(zone));
    }
    this.zones = runtimes;
  }

  private List<ZoneRuntime> zoneList() {
    return ImmutableList.copyOf(zones.values());
  }
}
