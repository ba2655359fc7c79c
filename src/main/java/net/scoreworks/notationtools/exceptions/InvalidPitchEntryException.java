/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exceptions;

import net.scoreworks.notationtools.NotationError;

/**
 * Thrown by the {@link net.scoreworks.notationtools.PitchEntryParser} when a single pitch entry is malformed. The
 * parse loop catches it and records the carried {@link NotationError}, so it never leaves
 * {@link net.scoreworks.notationtools.NotationParser#parse(String)}
 */
public class InvalidPitchEntryException extends RuntimeException {
    private final NotationError error;

    public InvalidPitchEntryException(NotationError error) {
        super(error.getMessage());
        this.error = error;
    }

    public NotationError getError() {
        return error;
    }
}
