package io.github.fiserro.homeheat.ufh;

/** Type of heating circuit a zone valve belongs to. */
public enum CircuitType {
  /** Ordinary floor loop heated on demand from the boiler. */
  REGULAR,
  /** Loop that circulates residual heat while the boiler is busy with domestic hot water. */
  FLUSH
}
