/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.collections4.ListUtils;

import java.util.ArrayList;
import java.util.List;


/**
 * Immutable outcome of {@link NotationParser#parse(String)}. Holds the chords that parsed cleanly, every recorded
 * error and whether the whole notation was valid. A result is valid exactly when no error was recorded.
 * <p>
 * A chord containing a malformed entry is left out entirely, so once an error was recorded the index of a chord in
 * {@link #getChords()} no longer matches its position in the notation. Use chord positions only of valid results.
 */
public final class ParseResult {
    private final List<MidiChord> chords;
    private final List<NotationError> errors;

    ParseResult(List<MidiChord> chords, List<NotationError> errors) {
        this.chords = ListUtils.unmodifiableList(new ArrayList<>(chords));
        this.errors = ListUtils.unmodifiableList(new ArrayList<>(errors));
    }

    public List<MidiChord> getChords() {
        return chords;
    }

    /**
     * @return the error messages in the order they were recorded
     */
    public List<String> getErrors() {
        List<String> messages = new ArrayList<>(errors.size());
        for (NotationError error : errors) {
            messages.add(error.getMessage());
        }
        return messages;
    }

    public List<NotationError> getErrorDetails() {
        return errors;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        strb.append(">ParseResult ").append(isValid() ? "valid" : "invalid").append(":");
        if (!chords.isEmpty())
            strb.append("\nchords: ").append(chords);
        if (!errors.isEmpty())
            strb.append("\nerrors: ").append(getErrors());
        return strb.append("\n").toString();
    }
}
