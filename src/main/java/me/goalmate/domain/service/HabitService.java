package me.goalmate.domain.service;


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

import lombok.extern.slf4j.Slf4j;
import me.goalmate.domain.model.CheckIn;
import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.Habit;
import me.goalmate.domain.model.Proof;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Daily habit tracker: check-ins, streak counters and freeze tokens.
 *
 * <p>
 * A habit accepts at most one log entry per calendar date, so a check-in and a
 * streak freeze on the same day exclude each other. Streaks reset lazily: on
 * every read or write, a habit whose latest log is older than yesterday drops
 * its current streak to zero.
 */
@Service
@Slf4j
public class HabitService {

    private static final String HABIT_NOT_FOUND = "Habit not found: ";

    private final GoalMateSession session;
    private final LevelingService levelingService;
    private final ActivityLogService activityLogService;
    private final GoalMateProperties properties;
    private final Clock clock;

    public HabitService(GoalMateSession session, LevelingService levelingService,
            ActivityLogService activityLogService, GoalMateProperties properties, Clock clock) {
        this.session = session;
        this.levelingService = levelingService;
        this.activityLogService = activityLogService;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Habit management ====================

    public Habit createHabit(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Habit name is required");
        }
        int freezeTokens = Math.max(0, properties.getHabits().getDefaultFreezeTokens());
        Habit habit = Habit.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .description(description)
                .streakFreezes(new Habit.StreakFreezes(freezeTokens, freezeTokens))
                .createdAt(Instant.now(clock))
                .build();

        synchronized (session.getLock()) {
            session.getHabits().add(habit);
        }
        log.info("[Habits] Created habit '{}'", habit.getName());
        return habit.copy();
    }

    public List<Habit> getHabits() {
        synchronized (session.getLock()) {
            LocalDate today = today();
            session.getHabits().forEach(habit -> refreshStreak(habit, today));
            return session.getHabits().stream()
                    .map(Habit::copy)
                    .toList();
        }
    }

    public Optional<Habit> getHabit(String habitId) {
        synchronized (session.getLock()) {
            Optional<Habit> habit = findHabit(habitId);
            habit.ifPresent(h -> refreshStreak(h, today()));
            return habit.map(Habit::copy);
        }
    }

    public boolean isCheckedInToday(String habitId) {
        return getHabit(habitId)
                .flatMap(h -> h.getLogFor(today()))
                .isPresent();
    }

    /**
     * Goal that references this habit, if any.
     */
    public Optional<Goal> findLinkedGoal(String habitId) {
        synchronized (session.getLock()) {
            return session.getGoals().stream()
                    .filter(g -> habitId.equals(g.getLinkedHabitId()))
                    .findFirst()
                    .map(Goal::copy);
        }
    }

    // ==================== Check-ins ====================

    /**
     * Checks in with the experience reward configured for the proof kind.
     */
    public CheckIn checkIn(String habitId, Proof proof) {
        if (proof == null || proof.getKind() == null) {
            throw new IllegalArgumentException("Proof is required");
        }
        return checkIn(habitId, proof, properties.getRewards().forProof(proof.getKind()));
    }

    /**
     * Logs today's completion, extends the streak and grants experience.
     *
     * @throws IllegalArgumentException
     *             if the proof is missing its payload or the habit is unknown
     * @throws IllegalStateException
     *             if the habit already has a log entry for today
     */
    public CheckIn checkIn(String habitId, Proof proof, int xpReward) {
        validateProof(proof);
        if (xpReward < 0) {
            throw new IllegalArgumentException("Experience reward must not be negative: " + xpReward);
        }

        synchronized (session.getLock()) {
            Habit habit = requireHabit(habitId);
            LocalDate today = today();
            refreshStreak(habit, today);
            if (habit.getLogFor(today).isPresent()) {
                throw new IllegalStateException("Already logged today for habit: " + habit.getName());
            }

            CheckIn checkIn = CheckIn.builder()
                    .date(today)
                    .status(CheckIn.CheckInStatus.COMPLETED)
                    .proof(Proof.builder()
                            .kind(proof.getKind())
                            .value(proof.hasValue() ? proof.getValue() : null)
                            .comment(proof.getComment())
                            .build())
                    .build();
            habit.getLogs().add(0, checkIn);
            habit.setCurrentStreak(habit.getCurrentStreak() + 1);
            habit.setLongestStreak(Math.max(habit.getLongestStreak(), habit.getCurrentStreak()));

            activityLogService.incrementCheckIns(today);
            levelingService.awardExperience(xpReward);

            log.info("[Habits] Check-in for '{}' ({}), streak {}", habit.getName(), proof.getKind(),
                    habit.getCurrentStreak());
            return checkIn.copy();
        }
    }

    /**
     * Spends a freeze token to cover today without extending the streak.
     *
     * @throws IllegalStateException
     *             if no tokens remain or today already has a log entry
     */
    public CheckIn useStreakFreeze(String habitId) {
        synchronized (session.getLock()) {
            Habit habit = requireHabit(habitId);
            LocalDate today = today();
            refreshStreak(habit, today);

            Habit.StreakFreezes freezes = habit.getStreakFreezes();
            if (freezes == null || freezes.getRemaining() <= 0) {
                throw new IllegalStateException("No streak freezes left for habit: " + habit.getName());
            }
            if (habit.getLogFor(today).isPresent()) {
                throw new IllegalStateException("Already logged today for habit: " + habit.getName());
            }

            CheckIn frozen = CheckIn.builder()
                    .date(today)
                    .status(CheckIn.CheckInStatus.FROZEN)
                    .proof(Proof.frozen())
                    .build();
            habit.getLogs().add(0, frozen);
            freezes.setRemaining(freezes.getRemaining() - 1);

            log.info("[Habits] Streak freeze used for '{}', {} left", habit.getName(), freezes.getRemaining());
            return frozen.copy();
        }
    }

    /**
     * Applies the missed-day reset to every habit. Intended for a day-rollover
     * check before rendering.
     */
    public void rolloverStreaks() {
        synchronized (session.getLock()) {
            LocalDate today = today();
            session.getHabits().forEach(habit -> refreshStreak(habit, today));
        }
    }

    // ==================== Internals ====================

    private void refreshStreak(Habit habit, LocalDate today) {
        if (habit.getCurrentStreak() == 0) {
            return;
        }
        Optional<LocalDate> latest = habit.getLatestLogDate();
        if (latest.isPresent() && latest.get().isBefore(today.minusDays(1))) {
            log.info("[Habits] Streak of '{}' reset after gap since {}", habit.getName(), latest.get());
            habit.setCurrentStreak(0);
        }
    }

    private void validateProof(Proof proof) {
        if (proof == null || proof.getKind() == null) {
            throw new IllegalArgumentException("Proof is required");
        }
        if (proof.getKind() == Proof.ProofKind.FROZEN) {
            throw new IllegalArgumentException("Use a streak freeze instead of a frozen check-in");
        }
        if (proof.getKind().requiresValue() && !proof.hasValue()) {
            throw new IllegalArgumentException(
                    "Please provide a " + proof.getKind().name().toLowerCase() + " to check in.");
        }
    }

    private Optional<Habit> findHabit(String habitId) {
        return session.getHabits().stream()
                .filter(h -> h.getId().equals(habitId))
                .findFirst();
    }

    private Habit requireHabit(String habitId) {
        return findHabit(habitId)
                .orElseThrow(() -> new IllegalArgumentException(HABIT_NOT_FOUND + habitId));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
