/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

/**
 * Converts note letter, octave and accidentals to a pitch number. Octave 4 starts at 48, so {@code c} is 48 and
 * {@code c'} is 60
 */
public final class PitchCalculator {
    public static final int SEMITONES_PER_OCTAVE = 12;

    private PitchCalculator() {}

    public static int pitch(NoteLetter letter, int octave, int pitchChange) {
        return octave * SEMITONES_PER_OCTAVE + letter.getPitchClass() + pitchChange;
    }

    public static int pitch(PitchEntry entry, int octave) {
        return pitch(entry.getLetter(), octave, entry.getPitchChange());
    }
}
