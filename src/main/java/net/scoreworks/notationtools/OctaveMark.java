/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.lang3.CharUtils;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;


/**
 * An immutable octave mark of a pitch entry. Raise and lower marks move the octave by one, a digit names the octave
 * outright
 */
public final class OctaveMark {

    public enum Kind {
        RAISE,
        LOWER,
        ABSOLUTE
    }

    public static final char RAISE_SYMBOL = '\'';
    public static final char LOWER_SYMBOL = ',';

    public static final OctaveMark RAISE = new OctaveMark(Kind.RAISE, 0);
    public static final OctaveMark LOWER = new OctaveMark(Kind.LOWER, 0);

    private final Kind kind;

    /** only meaningful for {@link Kind#ABSOLUTE} */
    private final int octave;

    private OctaveMark(Kind kind, int octave) {
        this.kind = kind;
        this.octave = octave;
    }

    public static OctaveMark absolute(int octave) {
        return new OctaveMark(Kind.ABSOLUTE, octave);
    }

    /**
     * @return the mark written as the given character, or null if it is no octave mark
     */
    public static @Nullable OctaveMark fromSymbol(char symbol) {
        if (symbol == RAISE_SYMBOL)
            return RAISE;
        if (symbol == LOWER_SYMBOL)
            return LOWER;
        if (CharUtils.isAsciiNumeric(symbol))
            return absolute(CharUtils.toIntValue(symbol));
        return null;
    }

    public Kind getKind() {
        return kind;
    }

    public int getOctave() {
        return octave;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof OctaveMark)) {
            return false;
        }
        OctaveMark other = (OctaveMark) o;
        return this.kind == other.kind && this.octave == other.octave;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, octave);
    }

    @Override
    public String toString() {
        switch (kind) {
            case RAISE: return String.valueOf(RAISE_SYMBOL);
            case LOWER: return String.valueOf(LOWER_SYMBOL);
            case ABSOLUTE: return Integer.toString(octave);
            default: throw new IllegalStateException("unknown octave mark " + kind);
        }
    }
}
