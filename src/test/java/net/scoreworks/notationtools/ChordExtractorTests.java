package net.scoreworks.notationtools;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ChordExtractorTests {

    @Test
    public void testChordsInOrder() {
        Assertions.assertEquals(List.of("e c' g' bf'", "f \\xNote c' a'"),
                ChordExtractor.extract("<e c' g' bf'>1\n<f \\xNote c' a'>1"));
    }

    @Test
    public void testNoBrackets() {
        Assertions.assertTrue(ChordExtractor.extract("").isEmpty());
        Assertions.assertTrue(ChordExtractor.extract("c e g").isEmpty());
        Assertions.assertTrue(ChordExtractor.extract("<c e g").isEmpty());
    }

    @Test
    public void testBracketsDontNest() {
        Assertions.assertEquals(List.of("c <e"), ChordExtractor.extract("<c <e> g>"));
    }

    @Test
    public void testNormalizeAndTokenize() {
        String chord = PitchEntryTokenizer.normalize("  F \\xNote C'  \\xNoteA' \t");
        Assertions.assertEquals("f xc'  xa'", chord);
        Assertions.assertEquals(List.of("f", "xc'", "xa'"), PitchEntryTokenizer.tokenize(chord));
        Assertions.assertTrue(PitchEntryTokenizer.tokenize("").isEmpty());
    }
}
