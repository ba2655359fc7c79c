/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;


/**
 * Immutable description of one malformed pitch entry. The message is meant to be shown to the exercise author as is
 */
public final class NotationError {
    private final ErrorKind kind;

    /** the pitch entry as written, including a leading hidden marker */
    private final String entry;

    /** the normalized chord string the entry was found in */
    private final String chord;

    /** characters that were not recognized, null for {@link ErrorKind#INVALID_NOTE_NAME} */
    private final String residue;

    private NotationError(ErrorKind kind, String entry, String chord, String residue) {
        this.kind = kind;
        this.entry = entry;
        this.chord = chord;
        this.residue = residue;
    }

    public static NotationError invalidNoteName(@NotNull String entry, @NotNull String chord) {
        return new NotationError(ErrorKind.INVALID_NOTE_NAME, entry, chord, null);
    }

    public static NotationError unrecognizedSymbol(@NotNull String entry, @NotNull String chord, @NotNull String residue) {
        return new NotationError(ErrorKind.UNRECOGNIZED_SYMBOL, entry, chord, residue);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getEntry() {
        return entry;
    }

    public String getChord() {
        return chord;
    }

    public @Nullable String getResidue() {
        return residue;
    }

    public String getMessage() {
        switch (kind) {
            case INVALID_NOTE_NAME:
                return "Pitch [" + entry + "] in chord [" + chord + "] is invalid: missing or invalid note name";
            case UNRECOGNIZED_SYMBOL:
                return "Pitch entry [" + entry + "] in chord [" + chord + "] contains unrecognized symbols: " + residue;
            default:
                throw new IllegalStateException("unknown error kind " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NotationError)) {
            return false;
        }
        NotationError other = (NotationError) o;
        return kind == other.kind && entry.equals(other.entry) && chord.equals(other.chord)
                && Objects.equals(residue, other.residue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, entry, chord, residue);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
