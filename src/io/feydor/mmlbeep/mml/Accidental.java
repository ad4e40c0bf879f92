package io.feydor.mmlbeep.mml;

public enum Accidental {
    NATURAL(0),
    /** '+' or '#' */
    SHARP(1),
    /** '-' */
    FLAT(-1);

    public final int shift;

    Accidental(int shift) {
        this.shift = shift;
    }

    /** Returns the accidental marked by c, or null when c is not an accidental marker */
    public static Accidental fromChar(char c) {
        return switch (c) {
            case '+', '#' -> SHARP;
            case '-' -> FLAT;
            default -> null;
        };
    }
}
