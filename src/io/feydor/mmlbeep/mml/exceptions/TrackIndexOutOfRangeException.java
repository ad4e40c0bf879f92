package io.feydor.mmlbeep.mml.exceptions;

/**
 * Thrown when the requested 1-based track does not exist in the score
 */
public class TrackIndexOutOfRangeException extends MmlException {
    public final int index;
    public final int trackCount;

    public TrackIndexOutOfRangeException(int index, int trackCount) {
        super("Track must be between 1 and " + trackCount + "! Given: " + index, -1);
        this.index = index;
        this.trackCount = trackCount;
    }
}
