/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.jetbrains.annotations.Nullable;


/**
 * The octave state carried from one pitch entry to the next during a single parse. Immutable: the parse loop
 * threads a new context through each entry instead of mutating shared state, so parsers stay reentrant
 */
public final class OctaveContext {

    /** octave every parse starts from */
    private final int startOctave;

    /** octave of the note the next entry refers to */
    private final int previousOctave;

    /** letter of the note the next entry refers to, null before the first note of a parse */
    private final NoteLetter previousLetter;

    private OctaveContext(int startOctave, int previousOctave, NoteLetter previousLetter) {
        this.startOctave = startOctave;
        this.previousOctave = previousOctave;
        this.previousLetter = previousLetter;
    }

    public static OctaveContext initial(int startOctave) {
        return new OctaveContext(startOctave, startOctave, null);
    }

    /**
     * @return the context after a note with the given letter was placed in the given octave
     */
    public OctaveContext advance(NoteLetter letter, int octave) {
        return new OctaveContext(startOctave, octave, letter);
    }

    /**
     * @return a context that keeps only the octave, so the next note gets no letter based shift
     */
    public OctaveContext withoutLetter() {
        return new OctaveContext(startOctave, previousOctave, null);
    }

    public int getStartOctave() {
        return startOctave;
    }

    public int getPreviousOctave() {
        return previousOctave;
    }

    public @Nullable NoteLetter getPreviousLetter() {
        return previousLetter;
    }

    @Override
    public String toString() {
        return "OctaveContext{start=" + startOctave + ", previous=" + (previousLetter == null ? "-" : previousLetter.getSymbol())
                + previousOctave + "}";
    }
}
