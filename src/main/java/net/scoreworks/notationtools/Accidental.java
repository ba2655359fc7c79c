/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.jetbrains.annotations.Nullable;

/**
 * Accidental marks following the note name. Marks stack, so "ss" raises by two semitones
 */
public enum Accidental {
    SHARP('s', 1),
    FLAT('f', -1);

    private final char symbol;
    private final int semitones;

    Accidental(char symbol, int semitones) {
        this.symbol = symbol;
        this.semitones = semitones;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getSemitones() {
        return semitones;
    }

    public static @Nullable Accidental fromSymbol(char symbol) {
        switch (symbol) {
            case 's': return SHARP;
            case 'f': return FLAT;
            default: return null;
        }
    }
}
