package io.feydor.mmlbeep.mml;

import io.feydor.mmlbeep.mml.exceptions.TrackIndexOutOfRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrackSplitterTest {
    @Test
    void emptyScoreHasOneEmptyTrack() {
        var tracks = TrackSplitter.split("");
        assertEquals(1, tracks.size());
        assertEquals(new TrackText(1, 0, ""), tracks.get(0));
    }

    @Test
    void commaSeparatesTracks() {
        var tracks = TrackSplitter.split("cde,efg\n,r");
        assertEquals(3, tracks.size());
        assertEquals(new TrackText(1, 0, "cde"), tracks.get(0));
        assertEquals(new TrackText(2, 4, "efg\n"), tracks.get(1));
        assertEquals(new TrackText(3, 9, "r"), tracks.get(2));
    }

    @Test
    void newlinesDoNotSeparateTracks() {
        assertEquals(1, TrackSplitter.split("c d e\nf g a\n").size());
    }

    @Test
    void scoreMarkerIsSkipped() {
        var tracks = TrackSplitter.split("MML@c,d");
        assertEquals(new TrackText(1, 4, "c"), tracks.get(0));
        assertEquals(new TrackText(2, 6, "d"), tracks.get(1));

        assertEquals("c", TrackSplitter.split("mml@c").get(0).text());
    }

    @Test
    void byteOrderMarkIsSkipped() {
        var tracks = TrackSplitter.split("\uFEFFMML@c,d");
        assertEquals(new TrackText(1, 5, "c"), tracks.get(0));
        assertEquals(new TrackText(2, 7, "d"), tracks.get(1));

        assertEquals(new TrackText(1, 1, "c d"), TrackSplitter.split("\uFEFFc d").get(0));
        assertEquals(new TrackText(1, 1, ""), TrackSplitter.split("\uFEFF").get(0));
    }

    @Test
    void semicolonEndsTheScore() {
        var tracks = TrackSplitter.split("MML@c,d;e,f,g");
        assertEquals(2, tracks.size());
        assertEquals("d", tracks.get(1).text());
    }

    @Test
    void selectIsOneBased() {
        String score = "c,d,e";
        assertEquals("c", TrackSplitter.select(score, 1).text());
        assertEquals("d", TrackSplitter.select(score, 2).text());
        assertEquals("e", TrackSplitter.select(score, 3).text());
    }

    @Test
    void whenGivenMissingTrack_thenThrowsException() {
        String score = "c,d";
        assertThrows(TrackIndexOutOfRangeException.class, () -> TrackSplitter.select(score, 0));
        assertThrows(TrackIndexOutOfRangeException.class, () -> TrackSplitter.select(score, -1));
        var e = assertThrows(TrackIndexOutOfRangeException.class, () -> TrackSplitter.select(score, 3));
        assertEquals(3, e.index);
        assertEquals(2, e.trackCount);
        assertEquals(-1, e.position);
    }
}
