/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.jetbrains.annotations.NotNull;


/**
 * Rules for placing a pitch entry in an octave. A {@link NotationParser} uses exactly one policy for a whole parse
 */
public enum OctavePolicy {

    /**
     * Every entry starts from the start octave, so {@code c} is always the same pitch and only its own marks move it.
     * Follows LilyPond's absolute octave entry
     */
    ABSOLUTE {
        @Override
        public int resolveOctave(@NotNull PitchEntry entry, @NotNull OctaveContext context) {
            return entry.applyOctaveMarks(context.getStartOctave());
        }

        @Override
        OctaveContext nextChordContext(OctaveContext chordStart, OctaveContext afterFirstEntry) {
            return chordStart;
        }
    },

    /**
     * Every entry is placed within a fifth of the previous note of its chord before its own marks apply. The first
     * entry of a chord gets no such shift, it starts from the octave of the previous chord's first entry
     */
    RELATIVE {
        @Override
        public int resolveOctave(@NotNull PitchEntry entry, @NotNull OctaveContext context) {
            NoteLetter previous = context.getPreviousLetter();
            int baseOctave = context.getPreviousOctave();
            if (previous != null)
                baseOctave += octaveShift(previous, entry.getLetter());
            return entry.applyOctaveMarks(baseOctave);
        }

        @Override
        OctaveContext nextChordContext(OctaveContext chordStart, OctaveContext afterFirstEntry) {
            return afterFirstEntry.withoutLetter();
        }
    };

    /** widest interval (counted inclusively, unison = 1) that stays in the previous note's octave */
    static final int LARGEST_INTERVAL_WITHOUT_SHIFT = 5;

    /**
     * @param entry parsed entry
     * @param context octave state before the entry
     * @return the absolute octave of the entry
     */
    public abstract int resolveOctave(@NotNull PitchEntry entry, @NotNull OctaveContext context);

    /**
     * Context the next chord starts from
     * @param chordStart context the finished chord started from
     * @param afterFirstEntry context after the finished chord's first entry
     */
    abstract OctaveContext nextChordContext(OctaveContext chordStart, OctaveContext afterFirstEntry);

    /**
     * Octave shift that keeps the step from the previous letter to the current one within a fifth
     */
    static int octaveShift(NoteLetter previous, NoteLetter current) {
        int distance = previous.getDiatonicIndex() - current.getDiatonicIndex();
        //count intervals inclusively: a step of one letter is a second
        distance += distance < 0 ? -1 : 1;
        if (Math.abs(distance) <= LARGEST_INTERVAL_WITHOUT_SHIFT)
            return 0;
        return distance < 0 ? -1 : 1;
    }
}
