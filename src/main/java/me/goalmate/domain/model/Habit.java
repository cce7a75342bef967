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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A daily habit with its check-in history. Logs are kept newest first and hold
 * at most one entry per calendar date.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Habit {

    private String id;
    private String name;
    private String description;

    private int currentStreak;
    private int longestStreak;

    @Builder.Default
    private StreakFreezes streakFreezes = new StreakFreezes(1, 1);

    @Builder.Default
    private List<CheckIn> logs = new ArrayList<>();

    private Instant createdAt;

    @JsonIgnore
    public Optional<CheckIn> getLogFor(LocalDate date) {
        return logs.stream()
                .filter(log -> date.equals(log.getDate()))
                .findFirst();
    }

    @JsonIgnore
    public Optional<LocalDate> getLatestLogDate() {
        return logs.stream()
                .map(CheckIn::getDate)
                .max(LocalDate::compareTo);
    }

    /**
     * Detached copy including its logs and freezes.
     */
    public Habit copy() {
        List<CheckIn> copiedLogs = new ArrayList<>();
        for (CheckIn log : logs) {
            copiedLogs.add(log.copy());
        }
        return toBuilder()
                .streakFreezes(streakFreezes != null
                        ? new StreakFreezes(streakFreezes.getRemaining(), streakFreezes.getTotal())
                        : null)
                .logs(copiedLogs)
                .build();
    }

    /**
     * Consumable streak-preserving tokens. {@code 0 <= remaining <= total}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StreakFreezes {
        private int remaining;
        private int total;
    }
}
