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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.goalmate.domain.model.LlmRequest;
import me.goalmate.domain.model.LlmResponse;
import me.goalmate.domain.model.ModuleSuggestion;
import me.goalmate.infrastructure.config.GoalMateProperties;
import me.goalmate.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates learning module suggestions for a goal.
 *
 * <p>
 * The provider is asked for a JSON array of {@code {name, description}}
 * objects, optionally wrapped in a Markdown code fence. Sample modules are
 * returned when no provider is configured and two placeholder modules when the
 * call or the parsing fails.
 */
@Service
@Slf4j
public class ModuleSuggestionService {

    private static final Pattern CODE_FENCE = Pattern.compile("^```(\\w*)?\\s*\\n?(.*?)\\n?\\s*```$",
            Pattern.DOTALL);
    private static final TypeReference<List<ModuleSuggestion>> SUGGESTIONS_TYPE = new TypeReference<>() {
    };

    static final List<ModuleSuggestion> ERROR_SUGGESTIONS = List.of(
            new ModuleSuggestion("AI Error: Could not generate introduction",
                    "There was an issue generating modules with AI."),
            new ModuleSuggestion("AI Error: Could not generate core concepts",
                    "Please try again later or add modules manually."));

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final GoalMateProperties properties;

    public ModuleSuggestionService(LlmPort llmPort, ObjectMapper objectMapper, GoalMateProperties properties) {
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public CompletableFuture<List<ModuleSuggestion>> suggestModules(String goalTitle, String goalDescription) {
        if (!llmPort.isAvailable()) {
            log.debug("[Insight] Provider unavailable, returning sample modules");
            return CompletableFuture.completedFuture(sampleSuggestions(goalTitle));
        }

        String prompt = """
                You are a curriculum designer for GoalMate, a goal-setting app for coding and language learning.
                A user wants to achieve the following goal:
                Goal Title: "%s"
                Goal Description: "%s"

                Suggest 3-5 learning modules. Each module has a concise name (3-7 words) and a brief \
                description (1-2 sentences).
                Respond with a JSON array of objects with "name" and "description" properties.
                """.formatted(goalTitle, goalDescription != null && !goalDescription.isBlank()
                ? goalDescription
                : "Not provided.");

        LlmRequest request = LlmRequest.ofPrompt(prompt);
        request.setMaxTokens(properties.getLlm().getLangchain4j().getMaxTokens());
        CompletableFuture<LlmResponse> response;
        try {
            response = llmPort.chat(request)
                    .orTimeout(properties.getInsight().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }

        return response
                .thenApply(this::parseSuggestions)
                .exceptionally(e -> {
                    log.warn("[Insight] Module suggestion failed: {}", e.getMessage());
                    return ERROR_SUGGESTIONS;
                });
    }

    List<ModuleSuggestion> parseSuggestions(LlmResponse response) {
        if (response == null || !response.hasContent()) {
            throw new IllegalStateException("Empty module suggestion response");
        }
        String json = stripCodeFence(response.getContent().trim());
        try {
            List<ModuleSuggestion> suggestions = objectMapper.readValue(json, SUGGESTIONS_TYPE);
            if (suggestions == null || suggestions.isEmpty()) {
                throw new IllegalStateException("Module suggestion response holds no modules");
            }
            return suggestions;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Module suggestion response is not a JSON array", e);
        }
    }

    static String stripCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        if (matcher.matches() && matcher.group(2) != null && !matcher.group(2).isBlank()) {
            return matcher.group(2).trim();
        }
        return text;
    }

    static List<ModuleSuggestion> sampleSuggestions(String goalTitle) {
        return List.of(
                new ModuleSuggestion("AI Suggested: Introduction to " + goalTitle,
                        "An AI-generated module covering the basics of " + goalTitle + "."),
                new ModuleSuggestion("AI Suggested: Core Concepts of " + goalTitle,
                        "An AI-generated module exploring key concepts related to " + goalTitle + "."),
                new ModuleSuggestion("AI Suggested: Practical Application for " + goalTitle,
                        "An AI-generated module focused on applying " + goalTitle + "."));
    }
}
