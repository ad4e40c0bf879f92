package io.feydor.mmlbeep.mml.exceptions;

/**
 * Thrown when an absolute note (the N command) is outside 1 (C1) to 96 (B8)
 */
public class InvalidNoteNumberException extends MmlException {
    public InvalidNoteNumberException(int noteNumber, int position) {
        super("Absolute note must be between 1 and 96! Given: " + noteNumber, position);
    }
}
