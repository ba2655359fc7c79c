/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.jetbrains.annotations.Nullable;


/**
 * The seven note names of the diatonic scale. The pitch class is the note's semitone offset above c, without any
 * accidental. The ordinal doubles as the diatonic index used to measure letter distances
 */
public enum NoteLetter {
    C('c', 0),
    D('d', 2),
    E('e', 4),
    F('f', 5),
    G('g', 7),
    A('a', 9),
    B('b', 11);

    private final char symbol;
    private final int pitchClass;

    NoteLetter(char symbol, int pitchClass) {
        this.symbol = symbol;
        this.pitchClass = pitchClass;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getPitchClass() {
        return pitchClass;
    }

    /**
     * Position within c d e f g a b, starting at 0
     */
    public int getDiatonicIndex() {
        return ordinal();
    }

    /**
     * @return the letter written as the lower-case symbol, or null if the character is no note name
     */
    public static @Nullable NoteLetter fromSymbol(char symbol) {
        switch (symbol) {
            case 'c': return C;
            case 'd': return D;
            case 'e': return E;
            case 'f': return F;
            case 'g': return G;
            case 'a': return A;
            case 'b': return B;
            default: return null;
        }
    }
}
