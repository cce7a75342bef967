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
import me.goalmate.domain.model.ExperienceAward;
import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.GoalModule;
import me.goalmate.domain.model.GoalProgress;
import me.goalmate.domain.model.Habit;
import me.goalmate.domain.model.ModuleSuggestion;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Goal and module state machine.
 *
 * <p>
 * Module transitions only move forward:
 * {@code PENDING -> COMPLETED(unverified) -> COMPLETED(verified)}, with
 * {@code PENDING -> COMPLETED(verified)} allowed directly. Nothing moves a
 * module back to {@code PENDING} or clears {@code verified}. Finalization
 * freezes a goal at 100% once its completion precondition holds.
 */
@Service
@Slf4j
public class GoalService {

    private static final String GOAL_NOT_FOUND = "Goal not found: ";
    private static final int MAX_PERCENT = 100;

    private final GoalMateSession session;
    private final LevelingService levelingService;
    private final HabitService habitService;
    private final ProgressProjector progressProjector;
    private final Clock clock;

    public GoalService(GoalMateSession session, LevelingService levelingService, HabitService habitService,
            ProgressProjector progressProjector, Clock clock) {
        this.session = session;
        this.levelingService = levelingService;
        this.habitService = habitService;
        this.progressProjector = progressProjector;
        this.clock = clock;
    }

    // ==================== Goal management ====================

    public Goal createGoal(String title, String category, String description, Goal.GoalKind kind,
            List<String> moduleNames) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Goal title is required");
        }
        Goal.GoalKind goalKind = kind != null ? kind : Goal.GoalKind.GENERIC;
        List<String> names = moduleNames != null ? moduleNames : List.of();
        if (goalKind == Goal.GoalKind.GENERIC && !names.isEmpty()) {
            throw new IllegalArgumentException("Only learning goals have modules");
        }

        Instant now = Instant.now(clock);
        List<GoalModule> modules = new ArrayList<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                modules.add(newModule(name.trim(), null, GoalModule.ModuleSource.USER));
            }
        }

        Goal goal = Goal.builder()
                .id(UUID.randomUUID().toString())
                .title(title.trim())
                .category(category)
                .description(description)
                .kind(goalKind)
                .modules(modules)
                .createdAt(now)
                .updatedAt(now)
                .build();

        synchronized (session.getLock()) {
            session.getGoals().add(goal);
        }
        log.info("[Goals] Created {} goal '{}' with {} modules", goalKind, goal.getTitle(), modules.size());
        return goal.copy();
    }

    public List<Goal> getGoals() {
        synchronized (session.getLock()) {
            return session.getGoals().stream()
                    .map(Goal::copy)
                    .toList();
        }
    }

    public Optional<Goal> getGoal(String goalId) {
        synchronized (session.getLock()) {
            return findGoal(goalId).map(Goal::copy);
        }
    }

    /**
     * Goals whose projected progress is below 100%.
     */
    public List<Goal> getActiveGoals() {
        synchronized (session.getLock()) {
            return session.getGoals().stream()
                    .filter(g -> progressProjector.project(g).percent() < MAX_PERCENT)
                    .map(Goal::copy)
                    .toList();
        }
    }

    public GoalProgress getProgress(String goalId) {
        synchronized (session.getLock()) {
            return progressProjector.project(requireGoal(goalId));
        }
    }

    // ==================== Modules ====================

    public GoalModule addModule(String goalId, String name, String description, GoalModule.ModuleSource source) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Module name is required");
        }
        synchronized (session.getLock()) {
            Goal goal = requireLearningGoal(goalId);
            requireNotFinalized(goal);
            GoalModule module = newModule(name.trim(), description,
                    source != null ? source : GoalModule.ModuleSource.USER);
            goal.getModules().add(module);
            touch(goal);
            log.debug("[Goals] Added module '{}' to '{}'", module.getName(), goal.getTitle());
            return module.copy();
        }
    }

    /**
     * Appends generated module suggestions as pending modules.
     */
    public List<GoalModule> addGeneratedModules(String goalId, List<ModuleSuggestion> suggestions) {
        synchronized (session.getLock()) {
            Goal goal = requireLearningGoal(goalId);
            requireNotFinalized(goal);
            List<GoalModule> added = new ArrayList<>();
            for (ModuleSuggestion suggestion : suggestions) {
                if (suggestion.name() == null || suggestion.name().isBlank()) {
                    continue;
                }
                GoalModule module = newModule(suggestion.name().trim(), suggestion.description(),
                        GoalModule.ModuleSource.GENERATED);
                goal.getModules().add(module);
                added.add(module.copy());
            }
            touch(goal);
            log.info("[Goals] Added {} generated modules to '{}'", added.size(), goal.getTitle());
            return added;
        }
    }

    /**
     * Marks a pending module completed without verification. A module that is
     * already completed (verified or not) is left untouched and earns nothing.
     */
    public ExperienceAward selfCompleteModule(String goalId, String moduleId, long xpReward) {
        requireRewardNotNegative(xpReward);
        synchronized (session.getLock()) {
            Goal goal = requireGoal(goalId);
            GoalModule module = requireModule(goal, moduleId);
            if (module.isCompleted()) {
                log.debug("[Goals] Module '{}' already completed, self-completion ignored", module.getName());
                return levelingService.awardExperience(0);
            }
            module.setStatus(GoalModule.ModuleStatus.COMPLETED);
            touch(goal);
            log.info("[Goals] Module '{}' self-completed", module.getName());
            return levelingService.awardExperience(xpReward);
        }
    }

    /**
     * Marks a module completed and verified. Re-verifying a verified module keeps
     * its state and awards the experience again.
     */
    public ExperienceAward verifyModule(String goalId, String moduleId, long xpReward) {
        requireRewardNotNegative(xpReward);
        synchronized (session.getLock()) {
            Goal goal = requireGoal(goalId);
            GoalModule module = requireModule(goal, moduleId);
            module.setStatus(GoalModule.ModuleStatus.COMPLETED);
            module.setVerified(true);
            touch(goal);
            log.info("[Goals] Module '{}' verified", module.getName());
            return levelingService.awardExperience(xpReward);
        }
    }

    // ==================== Generic progress ====================

    public Goal updateGenericProgress(String goalId, int percent, String statusText) {
        if (percent < 0 || percent > MAX_PERCENT) {
            throw new IllegalArgumentException("Progress must be between 0 and 100: " + percent);
        }
        synchronized (session.getLock()) {
            Goal goal = requireGoal(goalId);
            if (goal.isLearning()) {
                throw new IllegalArgumentException("Progress of a learning goal is derived from its modules");
            }
            requireNotFinalized(goal);
            goal.setProgressPercent(percent);
            goal.setStatusText(statusText);
            touch(goal);
            return goal.copy();
        }
    }

    // ==================== Finalization ====================

    /**
     * Locks a goal as completed. Learning goals need every module completed, which
     * a goal without modules satisfies; generic goals need 100% progress. Calling
     * it again on a finalized goal changes nothing.
     *
     * @throws IllegalStateException
     *             if the completion precondition does not hold
     */
    public Goal finalizeGoal(String goalId) {
        synchronized (session.getLock()) {
            Goal goal = requireGoal(goalId);
            if (goal.isFinalized()) {
                return goal.copy();
            }
            if (goal.isLearning()) {
                if (!goal.allModulesCompleted()) {
                    throw new IllegalStateException("Complete all modules before finalizing the goal");
                }
            } else if (goal.getProgressPercent() != MAX_PERCENT) {
                throw new IllegalStateException("Reach 100% progress before finalizing the goal");
            }

            goal.setStatusText(ProgressProjector.FINALIZED_TEXT);
            goal.setProgressPercent(MAX_PERCENT);
            goal.setFinalized(true);
            touch(goal);
            log.info("[Goals] Goal '{}' finalized", goal.getTitle());
            return goal.copy();
        }
    }

    // ==================== Habit links ====================

    /**
     * Stores the habit id on the goal. The id is not checked against existing
     * habits; {@link #getLinkedHabit} resolves it on read.
     */
    public Goal linkHabit(String goalId, String habitId) {
        synchronized (session.getLock()) {
            Goal goal = requireGoal(goalId);
            goal.setLinkedHabitId(habitId);
            touch(goal);
            log.info("[Goals] Linked habit {} to '{}'", habitId, goal.getTitle());
            return goal.copy();
        }
    }

    /**
     * Creates a habit and links it. Two independent steps: if linking fails the
     * new habit stays.
     */
    public Habit createAndLinkHabit(String goalId, String habitName) {
        if (getGoal(goalId).isEmpty()) {
            throw new IllegalArgumentException(GOAL_NOT_FOUND + goalId);
        }
        Habit habit = habitService.createHabit(habitName, null);
        linkHabit(goalId, habit.getId());
        return habit;
    }

    /**
     * Linked habit, or empty when none is linked or the id no longer resolves.
     */
    public Optional<Habit> getLinkedHabit(String goalId) {
        String habitId = requireGoalReadOnly(goalId).getLinkedHabitId();
        if (habitId == null) {
            return Optional.empty();
        }
        return habitService.getHabit(habitId);
    }

    // ==================== Internals ====================

    private GoalModule newModule(String name, String description, GoalModule.ModuleSource source) {
        return GoalModule.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .description(description)
                .source(source)
                .build();
    }

    private void requireRewardNotNegative(long xpReward) {
        if (xpReward < 0) {
            throw new IllegalArgumentException("Experience reward must not be negative: " + xpReward);
        }
    }

    private void touch(Goal goal) {
        goal.setUpdatedAt(Instant.now(clock));
    }

    private void requireNotFinalized(Goal goal) {
        if (goal.isFinalized()) {
            throw new IllegalStateException("Goal is already finalized: " + goal.getTitle());
        }
    }

    private Optional<Goal> findGoal(String goalId) {
        return session.getGoals().stream()
                .filter(g -> g.getId().equals(goalId))
                .findFirst();
    }

    private Goal requireGoal(String goalId) {
        return findGoal(goalId)
                .orElseThrow(() -> new IllegalArgumentException(GOAL_NOT_FOUND + goalId));
    }

    private Goal requireGoalReadOnly(String goalId) {
        synchronized (session.getLock()) {
            return requireGoal(goalId);
        }
    }

    private Goal requireLearningGoal(String goalId) {
        Goal goal = requireGoal(goalId);
        if (!goal.isLearning()) {
            throw new IllegalArgumentException("Only learning goals have modules");
        }
        return goal;
    }

    private GoalModule requireModule(Goal goal, String moduleId) {
        return goal.getModules().stream()
                .filter(m -> m.getId().equals(moduleId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Module not found: " + moduleId));
    }
}
