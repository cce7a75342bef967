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
import me.goalmate.domain.model.Quest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the provider's quest text into a {@link Quest}.
 *
 * <p>
 * Expected input is three labelled lines ({@code Quest Title:},
 * {@code Description:}, {@code Related Goal:}). When any label is missing or
 * empty, the whole text becomes the description and the related goal is the
 * first known goal title mentioned in it. Never throws.
 */
@Component
@Slf4j
public class QuestResponseParser {

    public static final String GENERIC_TITLE = "Weekly Quest Suggestion";
    public static final String GENERAL_GOAL = "General";
    public static final String FALLBACK_TITLE = "Quest Idea!";

    private static final String FALLBACK_LEAD = "Focus on making a solid leap forward in one of your goals this week.";

    private static final Pattern TITLE = labelPattern("Quest Title");
    private static final Pattern DESCRIPTION = labelPattern("Description");
    private static final Pattern RELATED_GOAL = labelPattern("Related Goal");

    private final Random random;

    public QuestResponseParser() {
        this(new Random());
    }

    QuestResponseParser(Random random) {
        this.random = random;
    }

    public Quest parse(String raw, List<String> goalTitles) {
        String text = raw != null ? raw : "";
        Optional<String> title = extract(TITLE, text);
        Optional<String> description = extract(DESCRIPTION, text);
        Optional<String> relatedGoal = extract(RELATED_GOAL, text);

        if (title.isPresent() && description.isPresent() && relatedGoal.isPresent()) {
            return new Quest(title.get(), description.get(), relatedGoal.get());
        }

        log.warn("[Quest] Unstructured quest text, using goal-title scan");
        String lower = text.toLowerCase(Locale.ROOT);
        String related = goalTitles == null ? GENERAL_GOAL
                : goalTitles.stream()
                        .filter(t -> t != null && !t.isBlank())
                        .filter(t -> lower.contains(t.toLowerCase(Locale.ROOT)))
                        .findFirst()
                        .orElse(GENERAL_GOAL);
        return new Quest(GENERIC_TITLE, text, related);
    }

    /**
     * Quest used when the provider produced nothing. Mentions a random active goal
     * when there is one.
     */
    public Quest fallback(List<String> activeGoalTitles) {
        if (activeGoalTitles == null || activeGoalTitles.isEmpty()) {
            return new Quest(FALLBACK_TITLE, FALLBACK_LEAD + " You've got this!", "");
        }
        String goal = activeGoalTitles.get(random.nextInt(activeGoalTitles.size()));
        return new Quest(FALLBACK_TITLE, FALLBACK_LEAD + " Perhaps something for '" + goal + "'?", goal);
    }

    private static Optional<String> extract(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Pattern labelPattern(String label) {
        return Pattern.compile("^[ \\t]*" + Pattern.quote(label) + ":[ \\t]*(.*)$", Pattern.MULTILINE);
    }
}
