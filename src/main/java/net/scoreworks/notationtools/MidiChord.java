/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import org.apache.commons.collections4.ListUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Pitch numbers of one chord, split into visible and hidden notes. Both lists keep the order the entries were written in
 */
public final class MidiChord {
    public static final String VISIBLE = "visible";
    public static final String HIDDEN = "hidden";

    private final List<Integer> visible;
    private final List<Integer> hidden;

    public MidiChord(@NotNull List<Integer> visible, @NotNull List<Integer> hidden) {
        this.visible = ListUtils.unmodifiableList(new ArrayList<>(visible));
        this.hidden = ListUtils.unmodifiableList(new ArrayList<>(hidden));
    }

    public List<Integer> getVisible() {
        return visible;
    }

    public List<Integer> getHidden() {
        return hidden;
    }

    public boolean isEmpty() {
        return visible.isEmpty() && hidden.isEmpty();
    }

    /**
     * The chord in the shape exercise records store it: {@code {"visible": [...], "hidden": [...]}}
     */
    public Map<String, List<Integer>> toMap() {
        Map<String, List<Integer>> map = new LinkedHashMap<>();
        map.put(VISIBLE, new ArrayList<>(visible));
        map.put(HIDDEN, new ArrayList<>(hidden));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MidiChord)) {
            return false;
        }
        MidiChord other = (MidiChord) o;
        return visible.equals(other.visible) && hidden.equals(other.hidden);
    }

    @Override
    public int hashCode() {
        return 31 * visible.hashCode() + hidden.hashCode();
    }

    @Override
    public String toString() {
        return "{visible=" + visible + ", hidden=" + hidden + "}";
    }
}
