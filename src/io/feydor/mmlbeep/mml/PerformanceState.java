package io.feydor.mmlbeep.mml;

/**
 * The mutable state carried across the commands of a single track
 */
public class PerformanceState {
    public static final int MIN_OCTAVE = 1;
    public static final int MAX_OCTAVE = 8;
    public static final int DEFAULT_OCTAVE = 4;
    public static final int DEFAULT_LENGTH = 4;
    public static final int DEFAULT_TEMPO = 120;

    public int octave = DEFAULT_OCTAVE;
    /** The note division used when a note or rest has no length of its own */
    public int defaultLength = DEFAULT_LENGTH;
    /** Set by "l8." and applied to notes and rests without a length of their own */
    public boolean defaultDotted;
    /** Quarter notes per minute */
    public int tempo = DEFAULT_TEMPO;

    public static boolean isValidOctave(int octave) {
        return octave >= MIN_OCTAVE && octave <= MAX_OCTAVE;
    }

    @Override
    public String toString() {
        return "PerformanceState{octave=" + octave + ", defaultLength=" + defaultLength
                + (defaultDotted ? "." : "") + ", tempo=" + tempo + "}";
    }
}
