package io.feydor.mmlbeep.mml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DurationsTest {
    @Test
    void quarterNoteAt120IsHalfASecond() {
        assertEquals(500, Durations.durationMs(120, 4, false));
        assertEquals(1000, Durations.durationMs(120, 2, false));
        assertEquals(2000, Durations.durationMs(120, 1, false));
        assertEquals(125, Durations.durationMs(120, 16, false));
    }

    @Test
    void doublingLengthOrTempoHalvesDuration() {
        assertEquals(Durations.durationMs(120, 4, false) / 2, Durations.durationMs(120, 8, false));
        assertEquals(Durations.durationMs(60, 4, false) / 2, Durations.durationMs(120, 4, false));
        assertEquals(Durations.durationMs(150, 1, false) / 2, Durations.durationMs(300, 1, false));
    }

    @Test
    void dottedIsOneAndAHalfTimesLonger() {
        assertEquals(750, Durations.durationMs(120, 4, true));
        assertEquals(375, Durations.durationMs(120, 8, true));
        for (int tempo = 32; tempo <= 255; tempo++) {
            for (int length : new int[]{1, 2, 3, 4, 6, 8, 12, 16, 32, 64}) {
                int base = Durations.durationMs(tempo, length, false);
                int dotted = Durations.durationMs(tempo, length, true);
                double exact = 60_000.0 * 4 / (tempo * length) * 1.5;
                assertEquals(Math.round(exact), dotted, "tempo=" + tempo + " length=" + length);
                assertTrue(dotted >= base);
            }
        }
    }

    @Test
    void neverShorterThanOneMs() {
        assertEquals(1, Durations.durationMs(1000, 100_000, false));
    }

    @Test
    void rejectsNonPositiveArguments() {
        assertThrows(IllegalArgumentException.class, () -> Durations.durationMs(0, 4, false));
        assertThrows(IllegalArgumentException.class, () -> Durations.durationMs(120, 0, false));
    }
}
