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

import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalModule;
import me.goalmate.domain.model.GoalProgress;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes display-ready progress for a goal. Stateless and side-effect free;
 * call it on every read since modules and stored fields change between reads.
 *
 * <p>
 * A finalized goal of either kind is complete. Otherwise learning goals derive
 * their progress from modules: a verified module counts fully, a
 * self-completed one counts half. Generic goals report their stored percent
 * and status text.
 */
@Component
public class ProgressProjector {

    public static final String NO_MODULES_TEXT = "No modules";
    public static final String COMPLETED_TEXT = "Completed!";
    public static final String NOT_STARTED_TEXT = "Not started";
    public static final String FINALIZED_TEXT = "Completed & Finalized!";

    public GoalProgress project(Goal goal) {
        if (goal.isFinalized()) {
            return new GoalProgress(100, FINALIZED_TEXT);
        }
        if (goal.isLearning()) {
            return projectModules(goal.getModules());
        }
        int percent = goal.getProgressPercent();
        String text = goal.getStatusText();
        if (text == null || text.isBlank()) {
            text = percent == 100 ? COMPLETED_TEXT : NOT_STARTED_TEXT;
        }
        return new GoalProgress(percent, text);
    }

    private GoalProgress projectModules(List<GoalModule> modules) {
        int total = modules == null ? 0 : modules.size();
        if (total == 0) {
            return new GoalProgress(0, NO_MODULES_TEXT);
        }

        int verifiedCount = 0;
        int halfCount = 0;
        for (GoalModule module : modules) {
            if (module.isVerified()) {
                verifiedCount++;
            } else if (module.isCompleted()) {
                halfCount++;
            }
        }

        // Counted in half-modules: round-half-up of 100 * (2v + h) / (2n)
        long halfUnits = 2L * verifiedCount + halfCount;
        int percent = (int) ((100L * halfUnits + total) / (2L * total));
        String text = String.format("%d Verified, %d Self-Completed / %d Total Modules",
                verifiedCount, halfCount, total);
        return new GoalProgress(percent, text);
    }
}
