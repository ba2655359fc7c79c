/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exercise;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.scoreworks.notationtools.MidiChord;
import net.scoreworks.notationtools.NotationParser;
import net.scoreworks.notationtools.ParseResult;
import net.scoreworks.notationtools.exceptions.ExerciseDefinitionException;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;


/**
 * A JSON-like exercise record, processed on construction. When the record carries chord notation under
 * {@link #NOTATION}, the notation is parsed and the resulting chords are merged into the record under
 * {@link #CHORDS}. A definition whose notation doesn't parse is invalid and must not be stored.
 */
public class ExerciseDefinition {
    public static final String TYPE = "type";
    public static final String DEFAULT_TYPE = "matching";
    public static final String NOTATION = "lilypond_chords";
    public static final String CHORDS = "chord";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Map<String, Object> data = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final NotationParser parser;

    /** null if the record has no notation */
    private ParseResult parseResult;

    public ExerciseDefinition(@NotNull Map<String, Object> data) {
        this(data, new NotationParser());
    }

    public ExerciseDefinition(@NotNull Map<String, Object> data, @NotNull NotationParser parser) {
        this.data.putAll(Objects.requireNonNull(data, "data"));
        this.parser = Objects.requireNonNull(parser, "parser");
        processData();
    }

    private void processData() {
        data.putIfAbsent(TYPE, DEFAULT_TYPE);
        if (!data.containsKey(NOTATION))
            return;

        Object notation = data.get(NOTATION);
        if (!(notation instanceof String)) {
            errors.add("Field [" + NOTATION + "] must be a string");
            return;
        }
        parseResult = parser.parse((String) notation);
        if (parseResult.isValid()) {
            List<Map<String, List<Integer>>> chords = new ArrayList<>();
            for (MidiChord chord : parseResult.getChords()) {
                chords.add(chord.toMap());
            }
            data.put(CHORDS, chords);
        }
        else errors.addAll(parseResult.getErrors());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return ListUtils.unmodifiableList(errors);
    }

    /**
     * @return read-only view of the processed record
     */
    public Map<String, Object> getData() {
        return MapUtils.unmodifiableMap(data);
    }

    public @Nullable ParseResult getParseResult() {
        return parseResult;
    }

    /**
     * @return the record as indented JSON with keys sorted
     */
    public String toJson() {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ExerciseDefinitionException("Exercise can't be written as JSON", e);
        }
    }

    public static ExerciseDefinition fromJson(@NotNull String json) {
        return fromJson(json, new NotationParser());
    }

    /**
     * Read a record from JSON and process it with the given parser
     * @throws ExerciseDefinitionException if the text is no JSON object
     */
    public static ExerciseDefinition fromJson(@NotNull String json, @NotNull NotationParser parser) {
        Map<String, Object> data;
        try {
            data = mapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ExerciseDefinitionException("Exercise JSON can't be read: " + e.getOriginalMessage(), e);
        }
        if (data == null)
            throw new ExerciseDefinitionException("Exercise JSON can't be read: no object found", null);
        return new ExerciseDefinition(data, parser);
    }

    @Override
    public String toString() {
        return "ExerciseDefinition" + (isValid() ? "" : " (invalid)") + " " + data;
    }
}
