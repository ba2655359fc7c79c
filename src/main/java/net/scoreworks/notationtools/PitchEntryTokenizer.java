/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;


/**
 * Normalizes one chord substring and splits it into pitch entries
 */
public final class PitchEntryTokenizer {

    /** single character that marks a hidden note after normalization */
    public static final char HIDDEN_NOTE_SYMBOL = 'x';

    /** the LilyPond command authors write for hidden notes */
    public static final String HIDDEN_NOTE_COMMAND = "\\xNote";

    private static final Pattern HIDDEN_NOTE_ESCAPE = Pattern.compile("\\\\xNote\\s*");

    private PitchEntryTokenizer() {}

    /**
     * Replace every {@code \xNote} (and the whitespace after it) by {@link #HIDDEN_NOTE_SYMBOL}, lower-case and strip.
     * Error messages refer to chords in this form
     */
    public static String normalize(@NotNull String chord) {
        String replaced = HIDDEN_NOTE_ESCAPE.matcher(chord).replaceAll(String.valueOf(HIDDEN_NOTE_SYMBOL));
        return StringUtils.strip(replaced.toLowerCase(Locale.ROOT));
    }

    /**
     * Split a normalized chord on runs of whitespace. Empty pieces are dropped
     */
    public static List<String> tokenize(@NotNull String normalizedChord) {
        return Arrays.asList(StringUtils.split(normalizedChord));
    }
}
