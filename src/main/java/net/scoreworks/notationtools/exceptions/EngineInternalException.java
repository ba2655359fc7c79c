/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exceptions;

/**
 * An exception that gets thrown if the notation engine reaches a state that violates its own invariants. Never
 * expected for any input string
 */
public class EngineInternalException extends RuntimeException {
    public EngineInternalException(String message) {
        super("Notation engine invariant violated: " + message);
    }
}
