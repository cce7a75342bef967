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
import me.goalmate.domain.model.LlmRequest;
import me.goalmate.domain.model.LlmResponse;
import me.goalmate.infrastructure.config.GoalMateProperties;
import me.goalmate.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Generative-text calls used by the product: verification questions,
 * acknowledgments, weekly quest text and buddy replies.
 *
 * <p>
 * None of these calls fails. An unconfigured provider, an error, a timeout or
 * an empty reply each resolve to a fixed default text.
 */
@Service
@Slf4j
public class InsightService {

    static final String QUESTION_UNAVAILABLE = "AI is not available. In your own words, what was the key takeaway from this module?";
    static final String QUESTION_EMPTY = "Could not generate a question. Please describe what you learned in this module.";
    static final String QUESTION_ERROR = "Error fetching question. How would you summarize this module's main idea?";

    static final String ACK_UNAVAILABLE = "Great effort! Thanks for sharing your thoughts.";
    static final String ACK_EMPTY = "Thanks for your input! Keep learning!";
    static final String ACK_ERROR = "Thanks for your response! Keep pushing forward!";

    static final String REPLY_UNAVAILABLE = "Got it, thanks for the update!";
    static final String REPLY_EMPTY = "Sounds good!";
    static final String REPLY_ERROR = "Cool, thanks for letting me know.";

    private final LlmPort llmPort;
    private final GoalMateProperties properties;

    public InsightService(LlmPort llmPort, GoalMateProperties properties) {
        this.llmPort = llmPort;
        this.properties = properties;
    }

    public CompletableFuture<String> askModuleQuestion(String goalTitle, String moduleName) {
        String prompt = """
                You are an assistant for GoalMate, a goal tracking app. A user wants to verify \
                their understanding of a learning module for their goal.
                Goal Title: "%s"
                Module Name: "%s"
                Ask one simple, open-ended conceptual question about "%s" suitable for a beginner. \
                It should invite a short text answer of 1-3 sentences. Do not ask for code.
                """.formatted(goalTitle, moduleName, moduleName);
        return complete("module question", prompt, QUESTION_UNAVAILABLE, QUESTION_EMPTY, QUESTION_ERROR);
    }

    public CompletableFuture<String> acknowledge(String goalTitle, String moduleName, String question,
            String answer) {
        String prompt = """
                You are an assistant for GoalMate, a goal tracking app. A user is verifying a learning module.
                Goal: "%s"
                Module: "%s"
                They were asked: "%s"
                Their answer: "%s"
                Write a brief, positive acknowledgment of their effort (1-2 sentences). Do not grade \
                the answer or confirm whether it is correct.
                """.formatted(goalTitle, moduleName, question, answer);
        return complete("acknowledgment", prompt, ACK_UNAVAILABLE, ACK_EMPTY, ACK_ERROR);
    }

    /**
     * Raw quest text for the given active goals. Empty when the provider is
     * unconfigured, fails, or answers with nothing.
     */
    public CompletableFuture<Optional<String>> suggestWeeklyQuest(List<String> activeGoalTitles) {
        if (!llmPort.isAvailable()) {
            log.debug("[Insight] Provider unavailable, no weekly quest text");
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String prompt = """
                You are a motivating assistant for GoalMate, a goal-setting app focused on coding and \
                language learning.
                A user has the following active goals: %s.
                Pick ONE of these goals and create a specific, achievable weekly quest (1-2 sentences).

                Output the quest in the following format EXACTLY:
                Quest Title: [a short, catchy title]
                Description: [the 1-2 sentence description]
                Related Goal: [the exact title of the goal you picked from the list]
                """.formatted(String.join(", ", activeGoalTitles));
        return call(prompt)
                .thenApply(response -> Optional.ofNullable(response)
                        .filter(LlmResponse::hasContent)
                        .map(r -> r.getContent().trim()))
                .exceptionally(e -> {
                    log.warn("[Insight] Weekly quest request failed: {}", e.getMessage());
                    return Optional.empty();
                });
    }

    public CompletableFuture<String> chatReply(String buddyName, String message) {
        String prompt = """
                You are %s, a friendly and supportive accountability buddy on the GoalMate app. \
                Your friend just sent you this message. Write a short, casual, encouraging reply \
                (1-2 sentences), like a real text message.
                Friend's message: "%s"
                """.formatted(buddyName, message);
        return complete("chat reply", prompt, REPLY_UNAVAILABLE, REPLY_EMPTY, REPLY_ERROR);
    }

    private CompletableFuture<String> complete(String purpose, String prompt, String unavailableText,
            String emptyText, String errorText) {
        if (!llmPort.isAvailable()) {
            log.debug("[Insight] Provider unavailable, default {}", purpose);
            return CompletableFuture.completedFuture(unavailableText);
        }
        return call(prompt)
                .thenApply(response -> response != null && response.hasContent()
                        ? response.getContent().trim()
                        : emptyText)
                .exceptionally(e -> {
                    log.warn("[Insight] {} request failed: {}", purpose, e.getMessage());
                    return errorText;
                });
    }

    private CompletableFuture<LlmResponse> call(String prompt) {
        Duration timeout = properties.getInsight().getTimeout();
        GoalMateProperties.Langchain4jProperties llm = properties.getLlm().getLangchain4j();
        LlmRequest request = LlmRequest.ofPrompt(prompt);
        request.setTemperature(llm.getTemperature());
        request.setMaxTokens(llm.getMaxTokens());
        try {
            return llmPort.chat(request).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
