package io.feydor.mmlbeep.mml;

/**
 * The seven note letters and their semitone offset from C within an octave
 */
public enum NoteLetter {
    C(0),
    D(2),
    E(4),
    F(5),
    G(7),
    A(9),
    B(11);

    public final int semitone;

    NoteLetter(int semitone) {
        this.semitone = semitone;
    }

    /**
     * @param c a letter from a to g, in either case
     * @return the matching letter, or null when c is not a note letter
     */
    public static NoteLetter fromChar(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'C' -> C;
            case 'D' -> D;
            case 'E' -> E;
            case 'F' -> F;
            case 'G' -> G;
            case 'A' -> A;
            case 'B' -> B;
            default -> null;
        };
    }
}
