package io.feydor.mmlbeep.mml.exceptions;

public class InvalidLengthException extends MmlException {
    public InvalidLengthException(int length, int position) {
        super("Note length must be greater than 0! Given: " + length, position);
    }
}
