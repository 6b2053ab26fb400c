package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.BooleanAggregation;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the current zone states into {@link ControllerActions} according to the controller's
 * {@link OperationMode}.
 *
 * <p>Fixed modes emit their heat request and secondary mode on every tick. AUTO emits them
 * only when they differ from the values last emitted, whichever mode emitted them.
 *
 * <p>Outside DISABLED a FAIL_SAFE zone is always commanded off and never requests heat, and a
 * FAIL_SAFE controller shuts everything down.
 */
@Slf4j
@RequiredArgsConstructor
public class ModeEngine {

  private static final int CYCLE_SLOTS = 8;

  private final ControllerConfig config;

  public ControllerActions evaluate(ControllerState controller, List<ZoneRuntime> zones,
      Instant now) {
    OperationMode mode = controller.mode();
    if (mode != OperationMode.DISABLED && controller.status() == ControllerStatus.FAIL_SAFE) {
      log.debug("Controller in FAIL_SAFE, forcing all zones off");
      return fixed(controller, allOff(zones), false, SecondaryMode.SUMMER);
    }

    return switch (mode) {
      case DISABLED -> ControllerActions.none();
      case ALL_ON -> fixed(controller, allOn(zones), true, SecondaryMode.WINTER);
      case ALL_OFF -> fixed(controller, allOff(zones), false, SecondaryMode.SUMMER);
      case FLUSH -> fixed(controller, allOn(zones), false, SecondaryMode.SUMMER);
      case CYCLE -> fixed(controller, cycle(zones, now), false, SecondaryMode.SUMMER);
      case AUTO -> auto(controller, zones, now);
    };
  }

  private ControllerActions fixed(ControllerState controller, Map<String, ZoneAction> actions,
      boolean heatRequest, SecondaryMode secondaryMode) {
    controller.flushRequest(false);
    controller.heatRequests().clear();
    controller.lastHeatRequest(heatRequest);
    controller.lastSecondaryMode(secondaryMode);
    return new ControllerActions(actions, heatRequest, secondaryMode);
  }

  private Map<String, ZoneAction> allOn(List<ZoneRuntime> zones) {
    Map<String, ZoneAction> actions = new LinkedHashMap<>();
    for (ZoneRuntime zone : zones) {
      ZoneState state = zone.state();
      actions.put(zone.id(), state.failSafe()
          ? ZoneAction.off(state.valveState())
          : ZoneAction.on(state.valveState()));
    }
    return actions;
  }

  private Map<String, ZoneAction> allOff(List<ZoneRuntime> zones) {
    Map<String, ZoneAction> actions = new LinkedHashMap<>();
    for (ZoneRuntime zone : zones) {
      actions.put(zone.id(), ZoneAction.off(zone.state().valveState()));
    }
    return actions;
  }

  private Map<String, ZoneAction> cycle(List<ZoneRuntime> zones, Instant now) {
    int slot = now.atZone(config.timeZone()).getHour() % CYCLE_SLOTS;
    int active = slot == 0 || zones.isEmpty() ? -1 : (slot - 1) % zones.size();
    log.debug("CYCLE: slot {}, active zone index {}", slot, active);

    Map<String, ZoneAction> actions = new LinkedHashMap<>();
    for (int i = 0; i < zones.size(); i++) {
      ZoneState state = zones.get(i).state();
      boolean on = i == active && !state.failSafe();
      actions.put(zones.get(i).id(), on
          ? ZoneAction.on(state.valveState())
          : ZoneAction.off(state.valveState()));
    }
    return actions;
  }

  private ControllerActions auto(ControllerState controller, List<ZoneRuntime> zones,
      Instant now) {
    TimingParams timing = config.timing();
    Map<String, ZoneAction> actions = new LinkedHashMap<>();

    boolean anyRegularOn = false;
    for (ZoneRuntime zone : zones) {
      if (zone.config().circuitType() == CircuitType.REGULAR) {
        ZoneAction action = autoAction(zone, controller, timing);
        if (action != null) {
          actions.put(zone.id(), action);
        }
        boolean on = action == null ? zone.state().valveState().isOn() : action.opensValve();
        anyRegularOn |= on;
      }
    }

    boolean flushRequest = ZoneScheduler.computeFlushRequest(controller.flushEnabled(),
        controller.dhwActive(), controller.flushUntil(), anyRegularOn, now);
    if (flushRequest != controller.flushRequest()) {
      log.info("Flush request {}", flushRequest ? "raised" : "cleared");
    }
    controller.flushRequest(flushRequest);

    for (ZoneRuntime zone : zones) {
      if (zone.config().circuitType() == CircuitType.FLUSH) {
        ZoneAction action = autoAction(zone, controller, timing);
        if (action != null) {
          actions.put(zone.id(), action);
        }
      }
    }

    controller.heatRequests().clear();
    for (ZoneRuntime zone : zones) {
      ZoneState state = zone.state();
      boolean request = !state.failSafe() && !state.quotaStale()
          && ZoneScheduler.shouldRequestHeat(state, timing, config.valveOpenThreshold());
      controller.heatRequests().put(zone.id(), request);
    }
    boolean heatRequest = BooleanAggregation.OR.aggregate(controller.heatRequests().values());
    SecondaryMode secondaryMode = heatRequest ? SecondaryMode.WINTER : SecondaryMode.SUMMER;

    Boolean emitHeat = null;
    if (!Objects.equals(controller.lastHeatRequest(), heatRequest)) {
      log.info("Heat request changed to {}", heatRequest);
      emitHeat = heatRequest;
      controller.lastHeatRequest(heatRequest);
    }
    SecondaryMode emitSecondary = null;
    if (controller.lastSecondaryMode() != secondaryMode) {
      log.info("Secondary heat source mode changed to {}", secondaryMode);
      emitSecondary = secondaryMode;
      controller.lastSecondaryMode(secondaryMode);
    }
    return new ControllerActions(actions, emitHeat, emitSecondary);
  }

  /**
   * Scheduler decision for one zone; {@code null} when the zone must not be commanded. A stale
   * quota skips only the decisions that depend on it: a disabled zone is still closed and a
   * flush circuit still follows the flush request.
   */
  private ZoneAction autoAction(ZoneRuntime zone, ControllerState controller,
      TimingParams timing) {
    ZoneState state = zone.state();
    if (state.failSafe()) {
      return ZoneAction.off(state.valveState());
    }
    boolean flushing = zone.config().circuitType() == CircuitType.FLUSH
        && controller.flushRequest();
    if (state.quotaStale() && state.enabled() && !flushing) {
      log.debug("Zone {}: quota stale, no command", zone.id());
      return null;
    }
    ZoneAction action = ZoneScheduler.evaluateZone(state, controller, timing,
        zone.config().circuitType());
    log.debug("Zone {}: {} (requested={}s, used={}s, valve={})", zone.id(), action,
        state.requestedDuration(), state.usedDuration(), state.valveState());
    return action;
  }
}
