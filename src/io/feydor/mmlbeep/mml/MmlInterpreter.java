package io.feydor.mmlbeep.mml;

import io.feydor.mmlbeep.mml.exceptions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Plays the commands of one track against a fresh {@link PerformanceState} and collects the resulting
 * {@link BeepEvent}s in playback order.
 * <p>
 * Tied notes are merged into a single event. The last event is held back as "pending" until the next note or
 * rest decides whether it is extended (tie) or final, so the output list is only ever appended to.
 * <p>
 * Any error aborts the whole track: no partial event list is returned.
 */
public final class MmlInterpreter {
    private static final Logger LOGGER = Logger.getLogger(MmlInterpreter.class.getName());

    private MmlInterpreter() {
    }

    public static List<BeepEvent> interpret(TrackText track) {
        return interpret(new MmlTokenizer(track));
    }

    public static List<BeepEvent> interpret(String trackText) {
        return interpret(new MmlTokenizer(trackText));
    }

    /**
     * @param commands the track's commands in order
     * @return the events of the track in playback order
     * @throws MmlException When a command is malformed or out of range, see the subclasses
     */
    public static List<BeepEvent> interpret(Iterable<PositionedCommand> commands) {
        var run = new Run();
        int lastPosition = 0;
        for (var positioned : commands) {
            run.position = positioned.position();
            lastPosition = positioned.position();
            positioned.command().accept(run);
        }
        run.finish(lastPosition);
        LOGGER.log(Level.FINE, "Interpreted {0} events, final state: {1}", new Object[]{run.events.size(), run.state});
        return Collections.unmodifiableList(run.events);
    }

    private static final class Run implements MmlCommand.Visitor<Void> {
        private final PerformanceState state = new PerformanceState();
        private final List<BeepEvent> events = new ArrayList<>();
        /** The last event, not yet in events since a tie may still extend it */
        private BeepEvent pending;
        private boolean pendingTied;
        private int position;

        @Override
        public Void visitSetOctave(MmlCommand.SetOctave cmd) {
            int octave = cmd.octave() == null ? PerformanceState.DEFAULT_OCTAVE : cmd.octave();
            if (!PerformanceState.isValidOctave(octave))
                throw new InvalidOctaveException(octave, position);
            state.octave = octave;
            return null;
        }

        @Override
        public Void visitShiftOctave(MmlCommand.ShiftOctave cmd) {
            int octave = state.octave + cmd.delta();
            if (!PerformanceState.isValidOctave(octave))
                throw new InvalidOctaveException(octave, position);
            state.octave = octave;
            return null;
        }

        @Override
        public Void visitSetDefaultLength(MmlCommand.SetDefaultLength cmd) {
            if (cmd.length() == null) {
                // "l." dots the current length, a bare "l" resets it
                if (!cmd.dotted())
                    state.defaultLength = PerformanceState.DEFAULT_LENGTH;
                state.defaultDotted = cmd.dotted();
                return null;
            }
            state.defaultLength = checkLength(cmd.length());
            state.defaultDotted = cmd.dotted();
            return null;
        }

        @Override
        public Void visitSetTempo(MmlCommand.SetTempo cmd) {
            int tempo = cmd.bpm() == null ? PerformanceState.DEFAULT_TEMPO : cmd.bpm();
            if (tempo <= 0)
                throw new InvalidTempoException(tempo, position);
            state.tempo = tempo;
            return null;
        }

        @Override
        public Void visitSetVolume(MmlCommand.SetVolume cmd) {
            LOGGER.log(Level.FINE, "Ignoring volume {0} at position {1}", new Object[]{cmd.volume(), position});
            return null;
        }

        @Override
        public Void visitNote(MmlCommand.Note cmd) {
            int frequency = Pitch.frequency(cmd.letter(), cmd.accidental(), state.octave);
            play(new BeepEvent(frequency, duration(cmd.length(), cmd.dotted())), cmd.tied());
            return null;
        }

        @Override
        public Void visitAbsoluteNote(MmlCommand.AbsoluteNote cmd) {
            if (cmd.number() < 1 || cmd.number() > 96)
                throw new InvalidNoteNumberException(cmd.number(), position);
            int octave = (cmd.number() - 1) / 12 + 1;
            int semitone = (cmd.number() - 1) % 12;
            play(new BeepEvent(Pitch.frequency(octave, semitone), duration(null, false)), cmd.tied());
            return null;
        }

        @Override
        public Void visitRest(MmlCommand.Rest cmd) {
            if (pendingTied)
                throw new TieMismatchException("A tied note must be followed by a note, not a rest", position);
            flush();
            pending = BeepEvent.rest(duration(cmd.length(), cmd.dotted()));
            return null;
        }

        private void play(BeepEvent note, boolean tied) {
            if (pendingTied) {
                if (pending.frequencyHz() != note.frequencyHz()) {
                    throw new TieMismatchException("Tied notes must have the same pitch: " + pending.frequencyHz()
                            + "Hz != " + note.frequencyHz() + "Hz", position);
                }
                try {
                    pending = pending.extendedBy(note.durationMs());
                } catch (ArithmeticException e) {
                    throw new DurationOverflowException(pending.durationMs(), note.durationMs(), position);
                }
            } else {
                flush();
                pending = note;
            }
            pendingTied = tied;
        }

        private void flush() {
            if (pending != null)
                events.add(pending);
            pending = null;
        }

        void finish(int lastPosition) {
            if (pendingTied)
                throw new TieMismatchException("The track ends with a tie that has no following note", lastPosition);
            flush();
        }

        private int duration(Integer length, boolean dotted) {
            if (length == null)
                return Durations.durationMs(state.tempo, state.defaultLength, dotted || state.defaultDotted);
            return Durations.durationMs(state.tempo, checkLength(length), dotted);
        }

        private int checkLength(int length) {
            if (length <= 0)
                throw new InvalidLengthException(length, position);
            return length;
        }
    }
}
