/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.notationtools.exercise;

import net.scoreworks.notationtools.exceptions.ExerciseStoreException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Storage for exercise definitions. How and where records are kept is up to the implementation
 */
public interface ExerciseStore {

    /**
     * @param groupName group to file the exercise under, null for the default group
     * @param definition a valid definition
     * @return id the exercise can be loaded with
     * @throws ExerciseStoreException if the exercise could not be stored
     */
    String save(@Nullable String groupName, @NotNull ExerciseDefinition definition);

    /**
     * @throws ExerciseStoreException if no exercise with this id exists or it can't be read
     */
    ExerciseDefinition load(@NotNull String exerciseId);
}
