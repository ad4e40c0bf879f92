package io.feydor.mmlbeep.mml;

import io.feydor.mmlbeep.mml.exceptions.MmlSyntaxException;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Turns the text of one track into {@link PositionedCommand}s.
 * <p>
 * The commands are produced lazily: a syntax error is only thrown once iteration reaches it.
 * Every call to {@link #iterator()} starts over from the beginning of the track.
 * <p>
 * Grammar (case-insensitive, whitespace between commands is skipped):
 * <pre>
 *   o[n]  &gt;  &lt;  l[n][.]  t[n]  v[n]  r[n][.]  n&lt;n&gt;[&amp;]  (a-g)[+#-][n][.][&amp;]
 * </pre>
 * Whitespace is also allowed between a note and its tie.
 */
public class MmlTokenizer implements Iterable<PositionedCommand> {
    private final String text;
    private final int offset;

    /**
     * @param text the text of a single track
     * @param offset the position of the text's first character in the score, added to every reported position
     */
    public MmlTokenizer(String text, int offset) {
        this.text = text;
        this.offset = offset;
    }

    public MmlTokenizer(TrackText track) {
        this(track.text(), track.offset());
    }

    public MmlTokenizer(String text) {
        this(text, 0);
    }

    @Override
    public Iterator<PositionedCommand> iterator() {
        return new Cursor();
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private final class Cursor implements Iterator<PositionedCommand> {
        private int i;

        @Override
        public boolean hasNext() {
            while (i < text.length() && isWhitespace(text.charAt(i)))
                i++;
            return i < text.length();
        }

        @Override
        public PositionedCommand next() {
            if (!hasNext())
                throw new NoSuchElementException("No more commands in the track");

            int start = i;
            char c = text.charAt(i++);
            MmlCommand cmd = switch (Character.toLowerCase(c)) {
                case 'o' -> new MmlCommand.SetOctave(readNumber());
                case '>' -> new MmlCommand.ShiftOctave(1);
                case '<' -> new MmlCommand.ShiftOctave(-1);
                case 'l' -> {
                    Integer length = readNumber();
                    yield new MmlCommand.SetDefaultLength(length, readDot());
                }
                case 't' -> new MmlCommand.SetTempo(readNumber());
                case 'v' -> new MmlCommand.SetVolume(readNumber());
                case 'r' -> {
                    Integer length = readNumber();
                    yield new MmlCommand.Rest(length, readDot());
                }
                case 'n' -> {
                    Integer number = readNumber();
                    if (number == null) {
                        char found = i < text.length() ? text.charAt(i) : c;
                        throw new MmlSyntaxException("Expected a note number after '" + c + "'", offset + i, found);
                    }
                    yield new MmlCommand.AbsoluteNote(number, readTie());
                }
                case 'a', 'b', 'c', 'd', 'e', 'f', 'g' -> readNote(NoteLetter.fromChar(c));
                default -> throw new MmlSyntaxException(offset + start, c);
            };
            return new PositionedCommand(cmd, offset + start);
        }

        private MmlCommand.Note readNote(NoteLetter letter) {
            Accidental accidental = Accidental.NATURAL;
            if (i < text.length()) {
                Accidental marked = Accidental.fromChar(text.charAt(i));
                if (marked != null) {
                    accidental = marked;
                    i++;
                }
            }
            Integer length = readNumber();
            boolean dotted = readDot();
            return new MmlCommand.Note(letter, accidental, length, dotted, readTie());
        }

        /** Reads the digits at the cursor, or returns null when there are none */
        private Integer readNumber() {
            int start = i;
            long value = 0;
            while (i < text.length() && isDigit(text.charAt(i))) {
                value = value * 10 + (text.charAt(i) - '0');
                if (value > Integer.MAX_VALUE)
                    throw new MmlSyntaxException("Number is too large", offset + start, text.charAt(start));
                i++;
            }
            return i == start ? null : (int) value;
        }

        private boolean readDot() {
            return consume('.');
        }

        /** A tie may be separated from its note by whitespace, including a line break */
        private boolean readTie() {
            int j = i;
            while (j < text.length() && isWhitespace(text.charAt(j)))
                j++;
            if (j < text.length() && text.charAt(j) == '&') {
                i = j + 1;
                return true;
            }
            return false;
        }

        private boolean consume(char expected) {
            if (i < text.length() && text.charAt(i) == expected) {
                i++;
                return true;
            }
            return false;
        }
    }
}
