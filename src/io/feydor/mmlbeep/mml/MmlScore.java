package io.feydor.mmlbeep.mml;

import io.feydor.mmlbeep.mml.exceptions.MmlException;
import io.feydor.mmlbeep.mml.exceptions.TrackIndexOutOfRangeException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * This class represents an MML score: one or more independent monophonic tracks.
 * <p>
 * The score text is split into tracks up front. A track is only tokenized and interpreted when its events are
 * requested, so a syntax error in one track does not prevent another track from being played.
 */
public class MmlScore {
    public final String filename;
    private final String text;
    private final List<TrackText> tracks;
    private final boolean verbose;

    /**
     * Reads and splits the score in a file
     * @param filename The file to read
     * @throws FileNotFoundException When the file does not exist
     * @throws IOException When the file cannot be read or is not valid UTF-8
     */
    public MmlScore(String filename, boolean verbose) throws IOException {
        this.filename = filename;
        this.verbose = verbose;
        logDebug("Reading " + filename + "...");
        try {
            this.text = Files.readString(Path.of(filename), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new FileNotFoundException("File not found!: " + filename);
        } catch (CharacterCodingException e) {
            throw new IOException("Not a UTF-8 text file: " + filename, e);
        }
        this.tracks = TrackSplitter.split(text);
        logDebug("Found %d track(s) in %s\n", tracks.size(), filename);
    }

    private MmlScore(String text) {
        this.filename = null;
        this.verbose = false;
        this.text = text;
        this.tracks = TrackSplitter.split(text);
    }

    /** Splits a score that is already in memory */
    public static MmlScore fromText(String text) {
        return new MmlScore(text);
    }

    public int numTracks() {
        return tracks.size();
    }

    /** Returns an unmodifiable view of the tracks */
    public List<TrackText> getTracks() {
        return tracks;
    }

    /**
     * @param index 1-based track number
     * @throws TrackIndexOutOfRangeException When the track does not exist
     */
    public TrackText getTrack(int index) {
        return TrackSplitter.select(tracks, index);
    }

    /**
     * Interprets a single track
     * @param index 1-based track number
     * @return the track's events in playback order
     * @throws MmlException When the track does not exist or cannot be interpreted
     */
    public List<BeepEvent> events(int index) {
        var track = getTrack(index);
        logDebug("Interpreting track %d (%d chars)...\n", index, track.text().length());
        var events = MmlInterpreter.interpret(track);
        logDebug("Track %d: %d events, %d ms\n", index, events.size(), totalDurationMs(events));
        return events;
    }

    /** Interprets every track. Fails on the first track that cannot be interpreted. */
    public List<List<BeepEvent>> allEvents() {
        return tracks.stream().map(track -> events(track.index())).toList();
    }

    public String getText() {
        return text;
    }

    public static long totalDurationMs(List<BeepEvent> events) {
        return events.stream().mapToLong(BeepEvent::durationMs).sum();
    }

    private void logDebug(String msg) {
        if (verbose) System.out.println("INFO: " + msg);
    }

    private void logDebug(String format, Object ... args) {
        if (verbose) System.out.printf("INFO: " + format, args);
    }
}
