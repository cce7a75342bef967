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
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.LevelProgress;
import me.goalmate.domain.model.LevelThresholds;
import me.goalmate.domain.model.Perk;
import me.goalmate.domain.model.UserProfile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Experience ledger of the session profile. Owns experience, level and perk
 * unlocks; every experience-granting action in the application goes through
 * {@link #awardExperience(long)}.
 *
 * <p>
 * Invariants kept here:
 * <ul>
 * <li>experience never decreases</li>
 * <li>level is the highest level whose threshold the experience reaches</li>
 * <li>a perk is unlocked once, in table order, and never removed</li>
 * </ul>
 */
@Service
@Slf4j
public class LevelingService {

    private final GoalMateSession session;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public LevelingService(GoalMateSession session, ActivityLogService activityLogService, Clock clock) {
        this.session = session;
        this.activityLogService = activityLogService;
        this.clock = clock;
    }

    /**
     * Adds experience, updates today's chart entry, and recomputes level and
     * perks. An amount of zero changes nothing.
     *
     * @throws IllegalArgumentException
     *             if amount is negative (no state is changed)
     */
    public ExperienceAward awardExperience(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Experience amount must not be negative: " + amount);
        }

        synchronized (session.getLock()) {
            UserProfile profile = session.getProfile();
            if (amount == 0) {
                return ExperienceAward.none(profile);
            }

            int previousLevel = profile.getLevel();
            long experience = profile.getExperience() + amount;
            profile.setExperience(experience);
            activityLogService.recordExperience(LocalDate.now(clock), experience);

            int level = LevelThresholds.advance(previousLevel, experience);
            profile.setLevel(level);
            if (level > previousLevel) {
                log.info("[Leveling] Level up: {} -> {} ({} XP)", previousLevel, level, experience);
            }

            List<Perk> unlocked = unlockReachedPerks(profile);
            log.debug("[Leveling] Awarded {} XP, total {}", amount, experience);
            return new ExperienceAward(amount, experience, previousLevel, level, unlocked);
        }
    }

    /**
     * Returns a detached copy of the profile.
     */
    public UserProfile getProfile() {
        synchronized (session.getLock()) {
            UserProfile profile = session.getProfile();
            return UserProfile.builder()
                    .experience(profile.getExperience())
                    .level(profile.getLevel())
                    .unlockedPerks(new LinkedHashSet<>(profile.getUnlockedPerks()))
                    .darkModeEnabled(profile.isDarkModeEnabled())
                    .build();
        }
    }

    public LevelProgress getLevelProgress() {
        synchronized (session.getLock()) {
            UserProfile profile = session.getProfile();
            int level = profile.getLevel();
            long experience = profile.getExperience();
            long currentLevelXp = LevelThresholds.threshold(level);
            long nextLevelXp = level < LevelThresholds.maxLevel()
                    ? LevelThresholds.threshold(level + 1)
                    : currentLevelXp + LevelThresholds.TOP_LEVEL_SPAN;
            long span = nextLevelXp - currentLevelXp;
            double percent = span > 0
                    ? Math.min(100.0, (experience - currentLevelXp) * 100.0 / span)
                    : 100.0;
            return new LevelProgress(level, experience, currentLevelXp, nextLevelXp, percent);
        }
    }

    /**
     * Toggles the dark theme. Enabling it requires the {@link Perk#DARK_MODE}
     * unlock.
     *
     * @throws IllegalStateException
     *             if enabling without the perk
     */
    public void setDarkMode(boolean enabled) {
        synchronized (session.getLock()) {
            UserProfile profile = session.getProfile();
            if (enabled && !profile.hasPerk(Perk.DARK_MODE)) {
                throw new IllegalStateException(
                        "Reach " + Perk.DARK_MODE.getXpRequired() + " XP to unlock " + Perk.DARK_MODE.getDisplayName());
            }
            profile.setDarkModeEnabled(enabled);
            log.debug("[Leveling] Dark mode {}", enabled ? "enabled" : "disabled");
        }
    }

    private List<Perk> unlockReachedPerks(UserProfile profile) {
        List<Perk> unlocked = new ArrayList<>();
        for (Perk perk : Perk.values()) {
            if (perk.isReachedBy(profile.getExperience()) && profile.getUnlockedPerks().add(perk)) {
                unlocked.add(perk);
                log.info("[Leveling] Perk unlocked: {}", perk.getDisplayName());
            }
        }
        return unlocked;
    }
}
