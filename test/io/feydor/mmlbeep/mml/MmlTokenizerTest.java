package io.feydor.mmlbeep.mml;

import io.feydor.mmlbeep.mml.MmlCommand.*;
import io.feydor.mmlbeep.mml.exceptions.MmlSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MmlTokenizerTest {
    private static List<MmlCommand> commands(String text) {
        var commands = new ArrayList<MmlCommand>();
        new MmlTokenizer(text).forEach(positioned -> commands.add(positioned.command()));
        return commands;
    }

    @Test
    void stateCommands() {
        assertEquals(List.of(
                new SetOctave(5),
                new SetOctave(null),
                new ShiftOctave(1),
                new ShiftOctave(-1),
                new SetDefaultLength(8, false),
                new SetDefaultLength(16, true),
                new SetDefaultLength(null, false),
                new SetTempo(150),
                new SetVolume(10),
                new SetVolume(null)
        ), commands("o5 o > < l8 l16. l t150 v10 v"));
    }

    @Test
    void notes() {
        assertEquals(List.of(
                new Note(NoteLetter.C, Accidental.NATURAL, null, false, false),
                new Note(NoteLetter.D, Accidental.SHARP, 8, false, false),
                new Note(NoteLetter.E, Accidental.FLAT, 16, true, false),
                new Note(NoteLetter.F, Accidental.SHARP, null, true, true),
                new Note(NoteLetter.G, Accidental.NATURAL, 2, false, true)
        ), commands("c d+8 e-16. f#.& g2&"));
    }

    @Test
    void restsAndAbsoluteNotes() {
        assertEquals(List.of(
                new Rest(null, false),
                new Rest(2, false),
                new Rest(null, true),
                new AbsoluteNote(49, false),
                new AbsoluteNote(60, true)
        ), commands("r r2 r. n49 n60&"));
    }

    @Test
    void commandsAreCaseInsensitive() {
        assertEquals(commands("t120 l8 o5 c d+ e r n12"), commands("T120 L8 O5 C D+ E R N12"));
    }

    @Test
    void commandsDoNotNeedWhitespace() {
        assertEquals(commands("o5 c8 d8 > e4."), commands("o5c8d8>e4."));
    }

    @Test
    void tieMayFollowWhitespace() {
        var tied = List.<MmlCommand>of(
                new Note(NoteLetter.C, Accidental.NATURAL, 4, false, true),
                new Note(NoteLetter.C, Accidental.NATURAL, 4, false, false));
        assertEquals(tied, commands("c4 &c4"));
        assertEquals(tied, commands("c4\n&c4"));
        assertEquals(tied, commands("c4 \r\n\t& c4"));
        assertEquals(List.of(new AbsoluteNote(49, true), new Note(NoteLetter.C, Accidental.NATURAL, null, false, false)),
                commands("n49 &c"));

        var positioned = new ArrayList<PositionedCommand>();
        new MmlTokenizer("c4 &c4").forEach(positioned::add);
        assertEquals(4, positioned.get(1).position());
    }

    @Test
    void tieStillNeedsANote() {
        var e = assertThrows(MmlSyntaxException.class, () -> commands(" &c"));
        assertEquals(1, e.position);
        e = assertThrows(MmlSyntaxException.class, () -> commands("r &c"));
        assertEquals(2, e.position);
        e = assertThrows(MmlSyntaxException.class, () -> commands("c& &c"));
        assertEquals(3, e.position);
    }

    @Test
    void positionsIncludeTheTrackOffset() {
        var positioned = new ArrayList<PositionedCommand>();
        new MmlTokenizer(" c\n d16", 10).forEach(positioned::add);
        assertEquals(2, positioned.size());
        assertEquals(11, positioned.get(0).position());
        assertEquals(14, positioned.get(1).position());
    }

    @Test
    void emptyAndBlankTracksHaveNoCommands() {
        assertTrue(commands("").isEmpty());
        assertTrue(commands(" \t\r\n ").isEmpty());
    }

    @Test
    void iterationCanBeRestarted() {
        var tokenizer = new MmlTokenizer("c d e");
        var first = new ArrayList<PositionedCommand>();
        var second = new ArrayList<PositionedCommand>();
        tokenizer.forEach(first::add);
        tokenizer.forEach(second::add);
        assertEquals(3, first.size());
        assertEquals(first, second);
    }

    @Test
    void syntaxErrorsAreReportedLazily() {
        var it = new MmlTokenizer("c d x e").iterator();
        assertInstanceOf(Note.class, it.next().command());
        assertInstanceOf(Note.class, it.next().command());
        var e = assertThrows(MmlSyntaxException.class, it::next);
        assertEquals(4, e.position);
        assertEquals('x', e.character);
    }

    @Test
    void whenGivenUnknownCharacter_thenThrowsException() {
        var e = assertThrows(MmlSyntaxException.class, () -> commands("c d ?"));
        assertEquals(4, e.position);
        assertEquals('?', e.character);

        // accidentals must directly follow the letter
        e = assertThrows(MmlSyntaxException.class, () -> commands("c +"));
        assertEquals(2, e.position);

        // a tie must directly follow a note
        e = assertThrows(MmlSyntaxException.class, () -> commands("&c"));
        assertEquals(0, e.position);
        e = assertThrows(MmlSyntaxException.class, () -> commands("c&&c"));
        assertEquals(2, e.position);
        assertThrows(MmlSyntaxException.class, () -> commands("r&c"));
    }

    @Test
    void absoluteNoteNeedsANumber() {
        var e = assertThrows(MmlSyntaxException.class, () -> commands("n c"));
        assertEquals(1, e.position);
        assertThrows(MmlSyntaxException.class, () -> commands("n"));
    }

    @Test
    void whenGivenHugeNumber_thenThrowsException() {
        var e = assertThrows(MmlSyntaxException.class, () -> commands("c99999999999"));
        assertEquals(1, e.position);
        assertEquals(List.of(new Note(NoteLetter.C, Accidental.NATURAL, Integer.MAX_VALUE, false, false)),
                commands("c2147483647"));
    }
}
