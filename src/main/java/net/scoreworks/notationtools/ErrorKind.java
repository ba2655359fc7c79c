/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

/**
 * The ways a single pitch entry can be malformed
 */
public enum ErrorKind {
    /** first character after the hidden marker is not one of the seven note names, or missing */
    INVALID_NOTE_NAME,
    /** characters after the note name that are neither octave marks, digits nor accidentals */
    UNRECOGNIZED_SYMBOL
}
