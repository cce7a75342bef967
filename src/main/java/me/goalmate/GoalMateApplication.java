package me.goalmate;


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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GoalMate Core.
 *
 * <p>
 * GoalMate turns user actions on goals and habits into consistent derived
 * state: completion percentages, experience points, levels, perks and streaks.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Leveling</b> - experience ledger with fixed level thresholds and perk
 * unlocks</li>
 * <li><b>Goals</b> - learning goals with verifiable modules and generic goals
 * with manual progress</li>
 * <li><b>Habits</b> - daily check-ins with proof, streaks and freeze
 * tokens</li>
 * <li><b>Insights</b> - verification questions, weekly quests and buddy replies
 * via langchain4j, with fixed fallbacks</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → WebFlux controllers under /api
 * Domain Layer       → Leveling, Goal, Habit, Quest and Verification services
 * Infrastructure     → LLM / Storage / Check-in log adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code goalmate.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GoalMateApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoalMateApplication.class, args);
    }

}
