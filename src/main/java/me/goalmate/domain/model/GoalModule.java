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

/**
 * A learning module owned by exactly one {@link Goal}. {@code verified} implies
 * {@code COMPLETED}; a completed module never returns to {@code PENDING}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GoalModule {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private ModuleStatus status = ModuleStatus.PENDING;

    private boolean verified;

    @Builder.Default
    private ModuleSource source = ModuleSource.USER;

    @JsonIgnore
    public boolean isCompleted() {
        return status == ModuleStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean isSelfCompleted() {
        return status == ModuleStatus.COMPLETED && !verified;
    }

    public GoalModule copy() {
        return toBuilder().build();
    }

    /**
     * Module completion states.
     */
    public enum ModuleStatus {
        PENDING, COMPLETED
    }

    /**
     * Who proposed the module.
     */
    public enum ModuleSource {
        USER, GENERATED
    }
}
