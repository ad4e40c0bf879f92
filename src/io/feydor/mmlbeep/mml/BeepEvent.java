package io.feydor.mmlbeep.mml;

/**
 * A single tone (or silence) to play on a single-tone device.
 *
 * @param frequencyHz the tone in Hz, 0 means a rest
 * @param durationMs how long to play the tone (or wait) in milliseconds
 */
public record BeepEvent(int frequencyHz, int durationMs) {
    public BeepEvent {
        if (frequencyHz < 0)
            throw new IllegalArgumentException("frequencyHz must not be negative: frequencyHz=" + frequencyHz);
        if (durationMs < 0)
            throw new IllegalArgumentException("durationMs must not be negative: durationMs=" + durationMs);
    }

    public static BeepEvent rest(int durationMs) {
        return new BeepEvent(0, durationMs);
    }

    public boolean isRest() {
        return frequencyHz == 0;
    }

    /**
     * Returns a copy of this event lasting durationMs longer
     * @throws ArithmeticException When the total duration does not fit in an int
     */
    public BeepEvent extendedBy(int durationMs) {
        return new BeepEvent(frequencyHz, Math.addExact(this.durationMs, durationMs));
    }
}
