package io.feydor.mmlbeep.mml.exceptions;

/**
 * Thrown when a tie (&amp;) is not followed by a note of the same pitch
 */
public class TieMismatchException extends MmlException {
    public TieMismatchException(String message, int position) {
        super(message, position);
    }
}
