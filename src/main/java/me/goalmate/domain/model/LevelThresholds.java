package me.goalmate.domain.model;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;

/**
 * Fixed level table mapping each level to the minimum cumulative experience it
 * requires. Level 1 starts at zero.
 */
public final class LevelThresholds {

    public static final int MIN_LEVEL = 1;

    /** Distance to the virtual next level once the table is exhausted. */
    public static final long TOP_LEVEL_SPAN = 150;

    private static final List<Long> THRESHOLDS = List.of(0L, 100L, 250L, 500L, 1000L);

    private LevelThresholds() {
    }

    public static int maxLevel() {
        return THRESHOLDS.size();
    }

    /**
     * Minimum experience for the given level.
     *
     * @throws IllegalArgumentException
     *             if the level is outside the table
     */
    public static long threshold(int level) {
        if (level < MIN_LEVEL || level > maxLevel()) {
            throw new IllegalArgumentException("Unknown level: " + level);
        }
        return THRESHOLDS.get(level - 1);
    }

    /**
     * Largest level whose threshold does not exceed the experience.
     */
    public static int levelFor(long experience) {
        return advance(MIN_LEVEL, experience);
    }

    /**
     * Walks the table upward from {@code currentLevel} while the next threshold
     * is reached. Never returns a level lower than {@code currentLevel}.
     */
    public static int advance(int currentLevel, long experience) {
        int level = Math.max(MIN_LEVEL, currentLevel);
        while (level < maxLevel() && experience >= threshold(level + 1)) {
            level++;
        }
        return level;
    }
}
