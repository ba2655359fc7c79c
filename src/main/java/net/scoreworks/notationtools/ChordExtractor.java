/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Splits a notation string like {@code "<e c' g' bf'>1 <f \xNote c' a'>1"} into the contents of its angle
 * bracket groups. Text outside the brackets (durations, bar checks) is dropped. Brackets don't nest
 */
public final class ChordExtractor {
    private static final Pattern CHORD = Pattern.compile("<([^>]+)>");

    private ChordExtractor() {}

    /**
     * @return the chord substrings in order of appearance, empty if the notation contains no bracket group
     */
    public static List<String> extract(@NotNull String notation) {
        List<String> chords = new ArrayList<>();
        Matcher matcher = CHORD.matcher(StringUtils.strip(notation));
        while (matcher.find()) {
            chords.add(matcher.group(1));
        }
        return chords;
    }
}
