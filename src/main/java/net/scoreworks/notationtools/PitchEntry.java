/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.collections4.ListUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;


/**
 * One parsed pitch entry of a chord, such as {@code xbf'} (a hidden b flat one octave up). Entries are created per
 * parse call and are not exposed through the {@link ParseResult}
 */
public final class PitchEntry {
    private final boolean hidden;
    private final NoteLetter letter;
    private final List<OctaveMark> octaveMarks;
    private final List<Accidental> accidentals;

    public PitchEntry(boolean hidden, @NotNull NoteLetter letter, @NotNull List<OctaveMark> octaveMarks, @NotNull List<Accidental> accidentals) {
        this.hidden = hidden;
        this.letter = Objects.requireNonNull(letter);
        this.octaveMarks = ListUtils.unmodifiableList(new ArrayList<>(octaveMarks));
        this.accidentals = ListUtils.unmodifiableList(new ArrayList<>(accidentals));
    }

    public boolean isHidden() {
        return hidden;
    }

    public NoteLetter getLetter() {
        return letter;
    }

    public List<OctaveMark> getOctaveMarks() {
        return octaveMarks;
    }

    public List<Accidental> getAccidentals() {
        return accidentals;
    }

    public boolean hasOctaveMarks() {
        return !octaveMarks.isEmpty();
    }

    /**
     * Sum of all accidentals in semitones
     */
    public int getPitchChange() {
        int pitchChange = 0;
        for (Accidental accidental : accidentals) {
            pitchChange += accidental.getSemitones();
        }
        return pitchChange;
    }

    /**
     * Apply the octave marks in order to a base octave. A digit replaces the base and discards raise/lower marks
     * seen before it, marks after the digit still count
     * @param baseOctave octave the entry would have without any marks
     */
    public int applyOctaveMarks(int baseOctave) {
        int octave = baseOctave;
        int octaveChange = 0;
        for (OctaveMark mark : octaveMarks) {
            switch (mark.getKind()) {
                case RAISE:
                    octaveChange++;
                    break;
                case LOWER:
                    octaveChange--;
                    break;
                case ABSOLUTE:
                    octave = mark.getOctave();
                    octaveChange = 0;
                    break;
            }
        }
        return octave + octaveChange;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof PitchEntry)) {
            return false;
        }
        PitchEntry other = (PitchEntry) o;
        return hidden == other.hidden && letter == other.letter
                && octaveMarks.equals(other.octaveMarks) && accidentals.equals(other.accidentals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hidden, letter, octaveMarks, accidentals);
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        if (hidden)
            strb.append(PitchEntryTokenizer.HIDDEN_NOTE_SYMBOL);
        strb.append(letter.getSymbol());
        for (Accidental accidental : accidentals) {
            strb.append(accidental.getSymbol());
        }
        for (OctaveMark mark : octaveMarks) {
            strb.append(mark);
        }
        return strb.toString();
    }
}
