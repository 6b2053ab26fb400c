package io.github.fiserro.homeheat.ufh;

/** Boiler mode selector: WINTER heats the floor circuit, SUMMER only produces hot water. */
public enum SecondaryMode {
  WINTER,
  SUMMER
}
