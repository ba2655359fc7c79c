/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exceptions;

/**
 * Raised by an {@link net.scoreworks.notationtools.exercise.ExerciseStore} when an exercise can't be saved or loaded
 */
public class ExerciseStoreException extends RuntimeException {
    public ExerciseStoreException(String message) {
        super(message);
    }

    public ExerciseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
