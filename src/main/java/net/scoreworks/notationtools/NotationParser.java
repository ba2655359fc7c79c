/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools;

import net.scoreworks.notationtools.exceptions.InvalidPitchEntryException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;


/**
 * Translates chord notation into MIDI pitch numbers. A notation string holds chords in angle brackets, each chord
 * holds whitespace separated pitch entries:
 *
 * <pre>
 *     &lt;e c' g' bf'&gt;1 &lt;f \xNote c' \xNote f' a'&gt;1
 * </pre>
 *
 * Parsing is accumulate-and-continue: a malformed entry records a {@link NotationError}, drops its chord and parsing
 * resumes with the next chord. Malformed notation never throws, it yields an invalid {@link ParseResult}.
 * <p>
 * A parser holds no state between calls and can be shared between threads.
 */
public class NotationParser {
    private static final Logger logger = LoggerFactory.getLogger(NotationParser.class);

    public static final int DEFAULT_START_OCTAVE = 4;

    private final OctavePolicy octavePolicy;
    private final int startOctave;

    /**
     * Parser using {@link OctavePolicy#ABSOLUTE} and {@link #DEFAULT_START_OCTAVE}
     */
    public NotationParser() {
        this(OctavePolicy.ABSOLUTE, DEFAULT_START_OCTAVE);
    }

    public NotationParser(@NotNull OctavePolicy octavePolicy) {
        this(octavePolicy, DEFAULT_START_OCTAVE);
    }

    public NotationParser(@NotNull OctavePolicy octavePolicy, int startOctave) {
        this.octavePolicy = Objects.requireNonNull(octavePolicy, "octavePolicy");
        this.startOctave = startOctave;
    }

    public OctavePolicy getOctavePolicy() {
        return octavePolicy;
    }

    public int getStartOctave() {
        return startOctave;
    }

    /**
     * @param notation chord notation, may be empty
     * @return a fresh result; invalid if any pitch entry was malformed
     * @throws NullPointerException if notation is null
     */
    public ParseResult parse(@NotNull String notation) {
        Objects.requireNonNull(notation, "notation must not be null");
        List<MidiChord> chords = new ArrayList<>();
        List<NotationError> errors = new ArrayList<>();
        OctaveContext context = OctaveContext.initial(startOctave);

        for (String rawChord : ChordExtractor.extract(notation)) {
            String chord = PitchEntryTokenizer.normalize(rawChord);
            try {
                ChordOutcome outcome = parseChord(chord, context);
                chords.add(outcome.chord);
                context = outcome.nextChordContext;
                logger.debug("Parsed chord [{}] to {}", chord, outcome.chord);
            } catch (InvalidPitchEntryException e) {
                //skip the rest of this chord and leave the octave context untouched
                errors.add(e.getError());
                logger.debug("Skipped chord [{}]: {}", chord, e.getMessage());
            }
        }
        return new ParseResult(chords, errors);
    }

    private ChordOutcome parseChord(String chord, OctaveContext chordStart) {
        List<Integer> visible = new ArrayList<>();
        List<Integer> hidden = new ArrayList<>();
        OctaveContext context = chordStart;
        OctaveContext afterFirstEntry = null;

        for (String token : PitchEntryTokenizer.tokenize(chord)) {
            PitchEntry entry = PitchEntryParser.parse(token, chord);
            int octave = octavePolicy.resolveOctave(entry, context);
            int pitch = PitchCalculator.pitch(entry, octave);
            if (entry.isHidden())
                hidden.add(pitch);
            else
                visible.add(pitch);
            context = context.advance(entry.getLetter(), octave);
            if (afterFirstEntry == null)
                afterFirstEntry = context;
        }

        OctaveContext next = afterFirstEntry == null ? chordStart : octavePolicy.nextChordContext(chordStart, afterFirstEntry);
        return new ChordOutcome(new MidiChord(visible, hidden), next);
    }

    private static final class ChordOutcome {
        final MidiChord chord;
        final OctaveContext nextChordContext;

        ChordOutcome(MidiChord chord, OctaveContext nextChordContext) {
            this.chord = chord;
            this.nextChordContext = nextChordContext;
        }
    }
}
