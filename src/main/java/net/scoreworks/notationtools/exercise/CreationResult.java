/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exercise;

import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;


/**
 * Immutable answer of {@link ExerciseService#createExercise(Map)}, shaped for rendering back to the exercise author
 */
public final class CreationResult {
    public enum Status {
        SUCCESS,
        ERROR
    }

    public static final String SUCCESS_MESSAGE = "Exercise created successfully!";
    public static final String ERROR_MESSAGE = "Exercise failed to save.";

    private final Status status;
    private final String message;
    private final String exerciseId;
    private final Map<String, Object> exercise;
    private final List<String> errors;

    private CreationResult(Status status, String message, String exerciseId, Map<String, Object> exercise, List<String> errors) {
        this.status = status;
        this.message = message;
        this.exerciseId = exerciseId;
        this.exercise = exercise;
        this.errors = errors;
    }

    static CreationResult success(String exerciseId, Map<String, Object> exercise) {
        return new CreationResult(Status.SUCCESS, SUCCESS_MESSAGE, exerciseId, MapUtils.unmodifiableMap(exercise),
                Collections.emptyList());
    }

    static CreationResult error(List<String> errors) {
        return new CreationResult(Status.ERROR, ERROR_MESSAGE, null, null,
                ListUtils.unmodifiableList(new ArrayList<>(errors)));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String getMessage() {
        return message;
    }

    public @Nullable String getExerciseId() {
        return exerciseId;
    }

    /**
     * @return the stored record, null unless successful
     */
    public @Nullable Map<String, Object> getExercise() {
        return exercise;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return status + ": " + message + (errors.isEmpty() ? "" : " " + errors);
    }
}
