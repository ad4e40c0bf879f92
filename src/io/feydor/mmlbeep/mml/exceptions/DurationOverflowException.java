package io.feydor.mmlbeep.mml.exceptions;

/**
 * Thrown when tied notes add up to a duration longer than Integer.MAX_VALUE ms
 */
public class DurationOverflowException extends MmlException {
    public DurationOverflowException(int tiedMs, int addedMs, int position) {
        super("Tied notes are too long! " + tiedMs + "ms + " + addedMs + "ms does not fit in a beep", position);
    }
}
