package io.github.fiserro.homeheat.ufh;

import io.github.fiserro.homeheat.persistence.ControllerSnapshot;

/** Output of one controller tick. */
public record TickResult(
    ControllerActions actions,
    ControllerStatus status,
    ControllerSnapshot snapshot) {}
