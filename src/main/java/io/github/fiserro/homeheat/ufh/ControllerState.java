package io.github.fiserro.homeheat.ufh;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Mutable runtime state of one controller, owned by its {@link HeatingController}.
 *
 * <p>{@code lastHeatRequest} and {@code lastSecondaryMode} hold the values last emitted in
 * {@link ControllerActions}; AUTO mode emits only when its outputs differ from them.
 */
@Getter
@Setter
@ToString
@Accessors(fluent = true)
public class ControllerState {

  private OperationMode mode = OperationMode.AUTO;
  private Instant observationStart;
  private double periodElapsed;
  private boolean flushEnabled;
  private boolean dhwActive;
  private Instant flushUntil;
  private boolean flushRequest;
  private final Map<String, Boolean> heatRequests = new LinkedHashMap<>();
  private Boolean lastHeatRequest;
  private SecondaryMode lastSecondaryMode;
  private ControllerStatus status = ControllerStatus.INITIALIZING;
}
