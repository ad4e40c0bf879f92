package io.feydor.mmlbeep.mml.exceptions;

/**
 * Thrown when the tokenizer meets a character that does not start or continue a command
 */
public class MmlSyntaxException extends MmlException {
    public final char character;

    public MmlSyntaxException(int position, char character) {
        super("Unexpected character '" + character + "'", position);
        this.character = character;
    }

    public MmlSyntaxException(String message, int position, char character) {
        super(message, position);
        this.character = character;
    }
}
