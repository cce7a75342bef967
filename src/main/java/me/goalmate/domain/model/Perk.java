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

import lombok.Getter;

/**
 * Static table of feature unlocks granted once cumulative experience crosses
 * the perk's threshold. Declaration order is the unlock order.
 */
@Getter
public enum Perk {

    DARK_MODE("Dark Mode Theme", 100),
    BUDDY_STATS("Buddy Insight Stats", 200),
    CUSTOM_CATEGORIES("Custom Goal Categories", 300),
    COMMUNITY_QUESTS("Community Quests", 500);

    private final String displayName;
    private final long xpRequired;

    Perk(String displayName, long xpRequired) {
        this.displayName = displayName;
        this.xpRequired = xpRequired;
    }

    public boolean isReachedBy(long experience) {
        return experience >= xpRequired;
    }
}
