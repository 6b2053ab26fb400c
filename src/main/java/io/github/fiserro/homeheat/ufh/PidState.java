package io.github.fiserro.homeheat.ufh;

/**
 * Snapshot of one PID calculation.
 *
 * <p>{@code integral} is both the accumulator carried to the next update and the integral
 * contribution to the output, in duty-cycle percent. {@code error} is carried as the previous
 * error for the derivative term.
 *
 * @param error setpoint minus current temperature
 * @param proportional proportional term
 * @param integral integral term (clamped accumulator)
 * @param derivative derivative term
 * @param dutyCycle output in percent, clamped to [0, 100]
 */
public record PidState(
    double error,
    double proportional,
    double integral,
    double derivative,
    double dutyCycle) {}
