package net.scoreworks.notationtools;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class NotationParserTests {
    NotationParser parser = new NotationParser();

    private static MidiChord chord(Integer... visible) {
        return new MidiChord(Arrays.asList(visible), Collections.emptyList());
    }

    private List<MidiChord> parseValid(String notation) {
        ParseResult result = parser.parse(notation);
        Assertions.assertTrue(result.isValid(), result.toString());
        Assertions.assertTrue(result.getErrors().isEmpty());
        return result.getChords();
    }

    @Test
    public void testOctaveMarksOnSingleNotes() {
        Assertions.assertEquals(List.of(chord(48)), parseValid("<c>"));
        Assertions.assertEquals(List.of(chord(60)), parseValid("<c'>"));
        Assertions.assertEquals(List.of(chord(36)), parseValid("<c,>"));
        Assertions.assertEquals(List.of(chord(72)), parseValid("<c''>"));
        Assertions.assertEquals(List.of(chord(48)), parseValid("<c',>"));
    }

    @Test
    public void testPitchClasses() {
        List<MidiChord> chords = parseValid("<c d e f g a b>");
        Assertions.assertEquals(List.of(48, 50, 52, 53, 55, 57, 59), chords.get(0).getVisible());
    }

    @Test
    public void testAccidentalsStack() {
        Assertions.assertEquals(49, parseValid("<cs>").get(0).getVisible().get(0));
        Assertions.assertEquals(46, parseValid("<cff>").get(0).getVisible().get(0));
        Assertions.assertEquals(50, parseValid("<css>").get(0).getVisible().get(0));
        //marks may be written in any order
        Assertions.assertEquals(parseValid("<cs'>"), parseValid("<c's>"));
        Assertions.assertEquals(48, parseValid("<csf>").get(0).getVisible().get(0));
        Assertions.assertEquals(70, parseValid("<bf'>").get(0).getVisible().get(0));
    }

    @Test
    public void testExplicitOctaveDigit() {
        Assertions.assertEquals(List.of(chord(60)), parseValid("<c5>"));
        Assertions.assertEquals(List.of(chord(3)), parseValid("<ef0>"));
        //the digit discards marks before it, marks after it still count
        Assertions.assertEquals(List.of(chord(60)), parseValid("<c'5>"));
        Assertions.assertEquals(List.of(chord(72)), parseValid("<c5'>"));
        //last digit wins
        Assertions.assertEquals(List.of(chord(60)), parseValid("<c45>"));
    }

    @Test
    public void testHiddenNotes() {
        MidiChord midiChord = parseValid("<x c>").get(0);
        Assertions.assertEquals(List.of(48), midiChord.getVisible());
        Assertions.assertEquals(List.of(48), midiChord.getHidden());

        midiChord = parseValid("<xc e>").get(0);
        Assertions.assertEquals(List.of(52), midiChord.getVisible());
        Assertions.assertEquals(List.of(48), midiChord.getHidden());
    }

    @Test
    public void testHiddenNoteCommand() {
        List<MidiChord> chords = parseValid("<e c' g' bf'>1\n<f \\xNote c' \\xNote f' a'>1");
        Assertions.assertEquals(2, chords.size());
        Assertions.assertEquals(List.of(52, 60, 67, 70), chords.get(0).getVisible());
        Assertions.assertTrue(chords.get(0).getHidden().isEmpty());
        Assertions.assertEquals(List.of(53, 69), chords.get(1).getVisible());
        Assertions.assertEquals(List.of(60, 65), chords.get(1).getHidden());
    }

    @Test
    public void testUpperCaseNotation() {
        Assertions.assertEquals(parseValid("<c e g>"), parseValid("<C E G>"));
    }

    @Test
    public void testTextOutsideBracketsIsIgnored() {
        List<MidiChord> chords = parseValid("  <c e g>2. | <d f a>4 r4  ");
        Assertions.assertEquals(List.of(chord(48, 52, 55), chord(50, 53, 57)), chords);
        Assertions.assertTrue(parseValid("c e g").isEmpty());
    }

    @Test
    public void testEmptyNotation() {
        ParseResult result = parser.parse("");
        Assertions.assertTrue(result.isValid());
        Assertions.assertTrue(result.getChords().isEmpty());
        Assertions.assertTrue(result.getErrors().isEmpty());
    }

    @Test
    public void testChordWithoutEntries() {
        Assertions.assertEquals(List.of(chord()), parseValid("< >"));
        Assertions.assertTrue(parseValid("<>").isEmpty());
    }

    @Test
    public void testNullNotationIsRejected() {
        Assertions.assertThrows(NullPointerException.class, () -> parser.parse(null));
    }

    @Test
    public void testInvalidNoteName() {
        ParseResult result = parser.parse("<z>");
        Assertions.assertFalse(result.isValid());
        Assertions.assertTrue(result.getChords().isEmpty());
        Assertions.assertEquals(List.of("Pitch [z] in chord [z] is invalid: missing or invalid note name"), result.getErrors());
        Assertions.assertEquals(ErrorKind.INVALID_NOTE_NAME, result.getErrorDetails().get(0).getKind());
    }

    @Test
    public void testHiddenMarkerWithoutNote() {
        ParseResult result = parser.parse("<c x>");
        Assertions.assertFalse(result.isValid());
        NotationError error = result.getErrorDetails().get(0);
        Assertions.assertEquals(ErrorKind.INVALID_NOTE_NAME, error.getKind());
        Assertions.assertEquals("x", error.getEntry());
        Assertions.assertEquals("c x", error.getChord());
    }

    @Test
    public void testUnrecognizedSymbol() {
        ParseResult result = parser.parse("<cq>");
        Assertions.assertFalse(result.isValid());
        Assertions.assertEquals(1, result.getErrorDetails().size());
        NotationError error = result.getErrorDetails().get(0);
        Assertions.assertEquals(ErrorKind.UNRECOGNIZED_SYMBOL, error.getKind());
        Assertions.assertEquals("q", error.getResidue());
        Assertions.assertEquals("Pitch entry [cq] in chord [cq] contains unrecognized symbols: q", error.getMessage());
    }

    @Test
    public void testErrorsReferToNormalizedChord() {
        ParseResult result = parser.parse("<C \\xNote Q>");
        Assertions.assertEquals(List.of("Pitch [xq] in chord [c xq] is invalid: missing or invalid note name"), result.getErrors());
    }

    @Test
    public void testParsingContinuesAfterFaultyChord() {
        ParseResult result = parser.parse("<c> <z> <e g#> <g>");
        Assertions.assertFalse(result.isValid());
        Assertions.assertEquals(List.of(chord(48), chord(55)), result.getChords());
        Assertions.assertEquals(2, result.getErrors().size());
        Assertions.assertEquals(ErrorKind.INVALID_NOTE_NAME, result.getErrorDetails().get(0).getKind());
        Assertions.assertEquals(ErrorKind.UNRECOGNIZED_SYMBOL, result.getErrorDetails().get(1).getKind());
        Assertions.assertEquals("#", result.getErrorDetails().get(1).getResidue());
    }

    @Test
    public void testNotesBeforeFaultyEntryAreDropped() {
        ParseResult result = parser.parse("<c e z> <g>");
        Assertions.assertFalse(result.isValid());
        //the chord after the faulty one moves up to the first position
        Assertions.assertEquals(List.of(chord(55)), result.getChords());
    }

    @Test
    public void testSharedParserAcrossThreads() throws Exception {
        NotationParser shared = new NotationParser(OctavePolicy.RELATIVE);
        String notation = "<e c' g' bf'>1 <f \\xNote c' \\xNote f' a'>1 <g b d' f'> <c, q> <c e g c'>";
        ParseResult expected = shared.parse(notation);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ParseResult>> calls = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                calls.add(() -> shared.parse(notation));
            }
            for (Future<ParseResult> future : executor.invokeAll(calls)) {
                ParseResult result = future.get();
                Assertions.assertEquals(expected.getChords(), result.getChords());
                Assertions.assertEquals(expected.getErrors(), result.getErrors());
                Assertions.assertFalse(result.isValid());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testFaultyEntryDropsWholeChord() {
        ParseResult result = parser.parse("<c e z g>");
        Assertions.assertFalse(result.isValid());
        Assertions.assertTrue(result.getChords().isEmpty());
        Assertions.assertEquals(1, result.getErrors().size());
    }

    @Test
    public void testResultIsImmutable() {
        ParseResult result = parser.parse("<c e g>");
        Assertions.assertThrows(UnsupportedOperationException.class, () -> result.getChords().clear());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> result.getChords().get(0).getVisible().add(1));
    }

    @Test
    public void testParserIsReusable() {
        parser.parse("<z>");
        Assertions.assertEquals(List.of(chord(48)), parseValid("<c>"));
    }
}
