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
import java.util.ArrayList;
import java.util.List;

/**
 * A user goal. Learning goals own an ordered list of modules and derive their
 * progress from them; generic goals carry their progress in
 * {@link #progressPercent} and {@link #statusText}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Goal {

    private String id;
    private String title;
    private String category;
    private String description;

    @Builder.Default
    private GoalKind kind = GoalKind.GENERIC;

    @Builder.Default
    private List<GoalModule> modules = new ArrayList<>();

    private int progressPercent;
    private String statusText;

    /**
     * Lookup key of a linked habit. Not an ownership edge; may dangle.
     */
    private String linkedHabitId;

    private boolean finalized;

    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isLearning() {
        return kind == GoalKind.LEARNING;
    }

    @JsonIgnore
    public boolean allModulesCompleted() {
        return modules.stream().allMatch(GoalModule::isCompleted);
    }

    /**
     * Detached copy including its modules.
     */
    public Goal copy() {
        List<GoalModule> copiedModules = new ArrayList<>();
        for (GoalModule module : modules) {
            copiedModules.add(module.copy());
        }
        return toBuilder().modules(copiedModules).build();
    }

    /**
     * Goal flavours.
     */
    public enum GoalKind {
        LEARNING, GENERIC
    }
}
