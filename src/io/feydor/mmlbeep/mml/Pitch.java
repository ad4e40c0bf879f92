package io.feydor.mmlbeep.mml;

/**
 * Equal-tempered 12-tone pitches, tuned to A4 = 440 Hz
 */
public final class Pitch {
    public static final double A4_HZ = 440.0;
    public static final int A4_OCTAVE = 4;

    private Pitch() {
    }

    /**
     * The frequency of a note rounded to the nearest Hz, since beep devices only take whole Hz.
     * A sharp B rolls over into the next octave's C, a flat C into the previous octave's B.
     *
     * @param letter the note letter
     * @param accidental the sharp/flat marker, or NATURAL
     * @param octave the octave, validated by the caller
     * @return the frequency in Hz
     */
    public static int frequency(NoteLetter letter, Accidental accidental, int octave) {
        return frequency(octave, letter.semitone + accidental.shift);
    }

    /**
     * @param octave the octave
     * @param semitone semitones above C in that octave, may fall outside 0 to 11
     * @return the frequency in Hz
     */
    public static int frequency(int octave, int semitone) {
        return (int) Math.round(exactFrequency(semitoneIndex(octave, semitone)));
    }

    /** Semitones relative to A4 */
    public static int semitoneIndex(int octave, int semitone) {
        return (octave - A4_OCTAVE) * 12 + (semitone - NoteLetter.A.semitone);
    }

    public static double exactFrequency(int semitoneIndex) {
        return A4_HZ * Math.pow(2, semitoneIndex / 12.0);
    }
}
