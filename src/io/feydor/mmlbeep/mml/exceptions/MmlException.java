package io.feydor.mmlbeep.mml.exceptions;

/**
 * Base class for every error raised while splitting or interpreting an MML score.
 * Carries the offset in the score where the error was detected, or -1 when the error has no position.
 */
public class MmlException extends RuntimeException {
    public final int position;

    public MmlException(String message, int position) {
        super(position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }
}
