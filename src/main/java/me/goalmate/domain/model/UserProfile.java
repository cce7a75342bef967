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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Process-wide player profile. Mutated only through
 * {@link me.goalmate.domain.service.LevelingService}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    @Builder.Default
    private long experience = 0;

    @Builder.Default
    private int level = LevelThresholds.MIN_LEVEL;

    /** Grows monotonically, insertion order is unlock order. */
    @Builder.Default
    private Set<Perk> unlockedPerks = new LinkedHashSet<>();

    private boolean darkModeEnabled;

    public boolean hasPerk(Perk perk) {
        return unlockedPerks.contains(perk);
    }
}
