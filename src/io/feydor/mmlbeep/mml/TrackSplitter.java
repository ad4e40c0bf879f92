package io.feydor.mmlbeep.mml;

import io.feydor.mmlbeep.mml.exceptions.TrackIndexOutOfRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a score into its tracks.
 * <p>
 * A score looks like: <code>[MML@]track1,track2,...,trackN[;ignored]</code>
 * <ul>
 *     <li>a leading byte-order mark is skipped</li>
 *     <li>the optional "MML@" marker at the very start is skipped</li>
 *     <li>',' starts a new track</li>
 *     <li>';' ends the score, anything after it is ignored</li>
 * </ul>
 * Newlines are ordinary whitespace inside a track. A score has at least one track, which may be empty.
 */
public final class TrackSplitter {
    public static final String SCORE_MARKER = "MML@";
    public static final char TRACK_SEPARATOR = ',';
    public static final char SCORE_END = ';';
    /** Left at the start of files saved as "UTF-8 with BOM" */
    public static final char BYTE_ORDER_MARK = '\uFEFF';

    private TrackSplitter() {
    }

    /**
     * @param score the whole score
     * @return every track in order, never empty
     */
    public static List<TrackText> split(String score) {
        int start = !score.isEmpty() && score.charAt(0) == BYTE_ORDER_MARK ? 1 : 0;
        if (score.regionMatches(true, start, SCORE_MARKER, 0, SCORE_MARKER.length()))
            start += SCORE_MARKER.length();
        int end = score.indexOf(SCORE_END, start);
        if (end < 0)
            end = score.length();

        var tracks = new ArrayList<TrackText>();
        int trackStart = start;
        for (int i = start; i < end; i++) {
            if (score.charAt(i) == TRACK_SEPARATOR) {
                tracks.add(new TrackText(tracks.size() + 1, trackStart, score.substring(trackStart, i)));
                trackStart = i + 1;
            }
        }
        tracks.add(new TrackText(tracks.size() + 1, trackStart, score.substring(trackStart, end)));
        return Collections.unmodifiableList(tracks);
    }

    /**
     * @param score the whole score
     * @param index 1-based track number
     * @return the selected track
     * @throws TrackIndexOutOfRangeException When index is less than 1 or greater than the number of tracks
     */
    public static TrackText select(String score, int index) {
        return select(split(score), index);
    }

    public static TrackText select(List<TrackText> tracks, int index) {
        if (index < 1 || index > tracks.size())
            throw new TrackIndexOutOfRangeException(index, tracks.size());
        return tracks.get(index - 1);
    }
}
