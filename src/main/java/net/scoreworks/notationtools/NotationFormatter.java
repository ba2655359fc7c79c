/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;


/**
 * Writes pitch numbers back into chord notation. Octaves are written as explicit digits, which fix the octave under
 * every {@link OctavePolicy}, so parsing the output yields the same pitch numbers again. Black keys are spelled with
 * sharps
 */
public final class NotationFormatter {
    private static final NoteLetter[] LETTERS = {
            NoteLetter.C, NoteLetter.C, NoteLetter.D, NoteLetter.D, NoteLetter.E, NoteLetter.F,
            NoteLetter.F, NoteLetter.G, NoteLetter.G, NoteLetter.A, NoteLetter.A, NoteLetter.B
    };
    private static final boolean[] SHARPENED = {
            false, true, false, true, false, false, true, false, true, false, true, false
    };

    private static final int LOWEST_DIGIT = 0;
    private static final int HIGHEST_DIGIT = 9;

    private NotationFormatter() {}

    /**
     * Spell a single pitch, e.g. 61 as {@code cs5}. Octaves outside 0..9 get the nearest digit plus octave marks
     */
    public static String spell(int pitch) {
        int octave = Math.floorDiv(pitch, PitchCalculator.SEMITONES_PER_OCTAVE);
        int pitchClass = Math.floorMod(pitch, PitchCalculator.SEMITONES_PER_OCTAVE);

        StringBuilder strb = new StringBuilder();
        strb.append(LETTERS[pitchClass].getSymbol());
        if (SHARPENED[pitchClass])
            strb.append(Accidental.SHARP.getSymbol());
        if (octave > HIGHEST_DIGIT)
            strb.append(HIGHEST_DIGIT).append(StringUtils.repeat(OctaveMark.RAISE_SYMBOL, octave - HIGHEST_DIGIT));
        else if (octave < LOWEST_DIGIT)
            strb.append(LOWEST_DIGIT).append(StringUtils.repeat(OctaveMark.LOWER_SYMBOL, LOWEST_DIGIT - octave));
        else
            strb.append(octave);
        return strb.toString();
    }

    /**
     * Write one chord, visible notes first, each hidden note preceded by {@code \xNote}
     */
    public static String format(@NotNull MidiChord chord) {
        //a chord without notes still needs content to be recognized as a chord
        if (chord.isEmpty())
            return "< >";
        List<String> entries = new ArrayList<>();
        for (int pitch : chord.getVisible()) {
            entries.add(spell(pitch));
        }
        for (int pitch : chord.getHidden()) {
            entries.add(PitchEntryTokenizer.HIDDEN_NOTE_COMMAND + " " + spell(pitch));
        }
        return "<" + StringUtils.join(entries, ' ') + ">";
    }

    public static String format(@NotNull List<MidiChord> chords) {
        List<String> formatted = new ArrayList<>(chords.size());
        for (MidiChord chord : chords) {
            formatted.add(format(chord));
        }
        return StringUtils.join(formatted, ' ');
    }
}
