package io.feydor.mmlbeep.mml;

/**
 * One syntactic MML command. Numeric fields that were omitted in the text are null, meaning
 * "use the current state".
 * <p>
 * Commands are consumed through a {@link Visitor}, so every consumer handles every kind of command.
 */
public sealed interface MmlCommand {
    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSetOctave(SetOctave cmd);

        R visitShiftOctave(ShiftOctave cmd);

        R visitSetDefaultLength(SetDefaultLength cmd);

        R visitSetTempo(SetTempo cmd);

        R visitSetVolume(SetVolume cmd);

        R visitNote(Note cmd);

        R visitAbsoluteNote(AbsoluteNote cmd);

        R visitRest(Rest cmd);
    }

    /** o[n] */
    record SetOctave(Integer octave) implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetOctave(this);
        }
    }

    /** &gt; (delta = 1) or &lt; (delta = -1) */
    record ShiftOctave(int delta) implements MmlCommand {
        public ShiftOctave {
            if (delta != 1 && delta != -1)
                throw new IllegalArgumentException("An octave shift is either 1 or -1: delta=" + delta);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShiftOctave(this);
        }
    }

    /** l[n][.] */
    record SetDefaultLength(Integer length, boolean dotted) implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetDefaultLength(this);
        }
    }

    /** t[n] */
    record SetTempo(Integer bpm) implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetTempo(this);
        }
    }

    /** v[n], has no effect on the output */
    record SetVolume(Integer volume) implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetVolume(this);
        }
    }

    /** a-g[+#-][n][.][&amp;] */
    record Note(NoteLetter letter, Accidental accidental, Integer length, boolean dotted, boolean tied)
            implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNote(this);
        }
    }

    /** n&lt;number&gt;[&amp;], where 1 is C1 and 96 is B8 */
    record AbsoluteNote(int number, boolean tied) implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbsoluteNote(this);
        }
    }

    /** r[n][.] */
    record Rest(Integer length, boolean dotted) implements MmlCommand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRest(this);
        }
    }
}
