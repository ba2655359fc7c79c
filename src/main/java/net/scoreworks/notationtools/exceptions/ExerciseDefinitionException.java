/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exceptions;

public class ExerciseDefinitionException extends RuntimeException {
    public ExerciseDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
