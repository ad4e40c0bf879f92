package io.feydor.mmlbeep.mml;

/**
 * Converts note lengths into milliseconds. A beat is a quarter note, so a whole note (length 1) lasts four beats.
 */
public final class Durations {
    private static final double MS_PER_MINUTE = 60_000.0;
    private static final int BEATS_PER_WHOLE_NOTE = 4;

    private Durations() {
    }

    /**
     * @param tempo beats (quarter notes) per minute, must be greater than 0
     * @param length the note division: 1 = whole, 4 = quarter, 16 = sixteenth. Must be greater than 0
     * @param dotted true to extend the note by half its value
     * @return the duration rounded to the nearest ms, at least 1
     */
    public static int durationMs(int tempo, int length, boolean dotted) {
        if (tempo <= 0)
            throw new IllegalArgumentException("tempo must be greater than 0: tempo=" + tempo);
        if (length <= 0)
            throw new IllegalArgumentException("length must be greater than 0: length=" + length);

        double ms = MS_PER_MINUTE * BEATS_PER_WHOLE_NOTE / ((double) tempo * length);
        if (dotted)
            ms *= 1.5;
        return (int) Math.max(1, Math.round(ms));
    }
}
