/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import net.scoreworks.notationtools.exceptions.EngineInternalException;
import net.scoreworks.notationtools.exceptions.InvalidPitchEntryException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;


/**
 * Turns a single pitch entry into a {@link PitchEntry}. An entry is an optional hidden marker, a note name and any
 * number of octave marks, octave digits and accidentals in any order, e.g. {@code cs'}, {@code xbf,,} or {@code e5}
 */
public final class PitchEntryParser {

    private PitchEntryParser() {}

    /**
     * @param entry a non-empty, normalized pitch entry
     * @param chord the normalized chord the entry belongs to, used for error messages
     * @throws InvalidPitchEntryException if the note name is missing or invalid or unknown symbols follow it
     */
    public static PitchEntry parse(@NotNull String entry, @NotNull String chord) {
        if (entry.isEmpty())
            throw new EngineInternalException("empty pitch entry in chord [" + chord + "]");

        int position = 0;
        boolean hidden = false;
        if (entry.charAt(0) == PitchEntryTokenizer.HIDDEN_NOTE_SYMBOL) {
            hidden = true;
            position++;
        }

        //the note name has to be checked before anything else
        NoteLetter letter = position < entry.length() ? NoteLetter.fromSymbol(entry.charAt(position)) : null;
        if (letter == null)
            throw new InvalidPitchEntryException(NotationError.invalidNoteName(entry, chord));
        position++;

        List<OctaveMark> octaveMarks = new ArrayList<>();
        List<Accidental> accidentals = new ArrayList<>();
        StringBuilder residue = new StringBuilder();
        for (; position < entry.length(); position++) {
            char symbol = entry.charAt(position);
            OctaveMark octaveMark = OctaveMark.fromSymbol(symbol);
            if (octaveMark != null) {
                octaveMarks.add(octaveMark);
                continue;
            }
            Accidental accidental = Accidental.fromSymbol(symbol);
            if (accidental != null) {
                accidentals.add(accidental);
                continue;
            }
            residue.append(symbol);
        }
        if (residue.length() > 0)
            throw new InvalidPitchEntryException(NotationError.unrecognizedSymbol(entry, chord, residue.toString()));

        return new PitchEntry(hidden, letter, octaveMarks, accidentals);
    }
}
