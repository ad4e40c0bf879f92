package io.feydor.mmlbeep.mml;

/**
 * The text of one track.
 *
 * @param index 1-based track number
 * @param offset where the text starts in the score, used to report score positions
 * @param text the MML commands of the track
 */
public record TrackText(int index, int offset, String text) {}
