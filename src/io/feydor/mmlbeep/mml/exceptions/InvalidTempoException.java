package io.feydor.mmlbeep.mml.exceptions;

public class InvalidTempoException extends MmlException {
    public InvalidTempoException(int tempo, int position) {
        super("Tempo must be greater than 0 bpm! Given: " + tempo, position);
    }
}
