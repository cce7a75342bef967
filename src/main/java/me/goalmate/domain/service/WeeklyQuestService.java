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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.Quest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one weekly quest fetch: picks the active goals, asks for quest text and
 * parses it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeeklyQuestService {

    static final Quest NO_GOALS = new Quest("No Goals Yet!", "Add a goal to get your first weekly quest!", "");
    static final Quest ALL_CONQUERED = new Quest("All Goals Conquered!",
            "Looks like you've completed all your current goals! Amazing! Add a new one for a fresh quest.", "");

    private final GoalService goalService;
    private final InsightService insightService;
    private final QuestResponseParser parser;

    public CompletableFuture<Quest> fetchWeeklyQuest() {
        List<Goal> goals = goalService.getGoals();
        if (goals.isEmpty()) {
            return CompletableFuture.completedFuture(NO_GOALS);
        }
        List<String> activeTitles = goalService.getActiveGoals().stream()
                .map(Goal::getTitle)
                .toList();
        if (activeTitles.isEmpty()) {
            return CompletableFuture.completedFuture(ALL_CONQUERED);
        }

        List<String> allTitles = goals.stream().map(Goal::getTitle).toList();
        return insightService.suggestWeeklyQuest(activeTitles)
                .thenApply(raw -> raw
                        .map(text -> parser.parse(text, allTitles))
                        .orElseGet(() -> {
                            log.info("[Quest] No quest text from provider, using fallback quest");
                            return parser.fallback(activeTitles);
                        }));
    }
}
