/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exercise;

import net.scoreworks.notationtools.NotationParser;
import net.scoreworks.notationtools.exceptions.ExerciseStoreException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * Creates exercises from submitted records. Records are only handed to the {@link ExerciseStore} when their
 * notation parsed without errors
 */
public class ExerciseService {
    private static final Logger logger = LoggerFactory.getLogger(ExerciseService.class);

    /** field of a submitted record naming the group, not part of the stored exercise */
    public static final String GROUP_NAME = "group_name";

    private final ExerciseStore store;
    private final NotationParser parser;

    public ExerciseService(@NotNull ExerciseStore store) {
        this(store, new NotationParser());
    }

    public ExerciseService(@NotNull ExerciseStore store, @NotNull NotationParser parser) {
        this.store = Objects.requireNonNull(store, "store");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @param data submitted record, optionally with a {@link #GROUP_NAME}. Not modified
     */
    public CreationResult createExercise(@NotNull Map<String, Object> data) {
        Map<String, Object> record = new LinkedHashMap<>(data);
        Object groupName = record.remove(GROUP_NAME);
        ExerciseDefinition definition = new ExerciseDefinition(record, parser);
        if (!definition.isValid()) {
            logger.warn("Rejected exercise with {} error(s): {}", definition.getErrors().size(), definition.getErrors());
            return CreationResult.error(definition.getErrors());
        }

        String exerciseId;
        try {
            exerciseId = store.save(groupName == null ? null : groupName.toString(), definition);
        } catch (ExerciseStoreException e) {
            logger.warn("Failed to store exercise: {}", e.getMessage());
            return CreationResult.error(Collections.singletonList(e.getMessage()));
        }
        logger.info("Created exercise {}", exerciseId);
        return CreationResult.success(exerciseId, definition.getData());
    }

    public ExerciseDefinition loadExercise(@NotNull String exerciseId) {
        return store.load(exerciseId);
    }
}
