package io.github.fiserro.homeheat.ufh;

/** Controller operation modes. Transitions are operator-set, never self-triggered. */
public enum OperationMode {
  /** Quota-based scheduling of every zone. */
  AUTO,
  /** Circulation through every loop without boiler heat. */
  FLUSH,
  /** Rotates one open zone per hour on an 8-hour cycle. */
  CYCLE,
  ALL_ON,
  ALL_OFF,
  /** Hands off: no commands at all. */
  DISABLED
}
