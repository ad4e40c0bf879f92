package io.feydor.mmlbeep.mml.exceptions;

/**
 * Thrown when an octave command (o, &lt; or &gt;) would leave the range 1 to 8
 */
public class InvalidOctaveException extends MmlException {
    public InvalidOctaveException(int octave, int position) {
        super("Octave must be between 1 and 8! Given: " + octave, position);
    }
}
