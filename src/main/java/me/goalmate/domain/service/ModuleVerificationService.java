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
import me.goalmate.domain.model.ExperienceAward;
import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalModule;
import me.goalmate.domain.model.VerificationChallenge;
import me.goalmate.domain.model.VerificationOutcome;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Question-and-answer verification of a learning module.
 *
 * <p>
 * Flow: {@link #start} opens a dialog holding the module's operation token and
 * fetches a question; {@link #submitAnswer} fetches an acknowledgment and then
 * verifies the module; {@link #selfComplete} closes the dialog with an
 * unverified completion; {@link #cancel} abandons it. A result that arrives
 * after its dialog was cancelled or expired is discarded without side effects.
 */
@Service
@Slf4j
public class ModuleVerificationService {

    private static final String KEY_PREFIX = "module:";

    private final GoalService goalService;
    private final InsightService insightService;
    private final InFlightRegistry inFlightRegistry;
    private final GoalMateProperties properties;

    private final Map<String, VerificationChallenge> challenges = new ConcurrentHashMap<>();
    private final Set<String> submitting = ConcurrentHashMap.newKeySet();

    public ModuleVerificationService(GoalService goalService, InsightService insightService,
            InFlightRegistry inFlightRegistry, GoalMateProperties properties) {
        this.goalService = goalService;
        this.insightService = insightService;
        this.inFlightRegistry = inFlightRegistry;
        this.properties = properties;
    }

    /**
     * Opens a verification dialog and asks for a question.
     *
     * @throws IllegalArgumentException
     *             if the goal or module does not exist
     * @throws IllegalStateException
     *             if a verification for the module is already in progress
     */
    public CompletableFuture<VerificationChallenge> start(String goalId, String moduleId) {
        Goal goal = goalService.getGoal(goalId)
                .orElseThrow(() -> new IllegalArgumentException("Goal not found: " + goalId));
        GoalModule module = goal.getModules().stream()
                .filter(m -> m.getId().equals(moduleId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Module not found: " + moduleId));

        String ticket = inFlightRegistry.acquire(key(moduleId));
        evictStaleChallenges();
        VerificationChallenge challenge = new VerificationChallenge(ticket, goalId, moduleId, goal.getTitle(),
                module.getName(), null);
        challenges.put(ticket, challenge);
        log.info("[Verification] Started for module '{}'", module.getName());

        return insightService.askModuleQuestion(goal.getTitle(), module.getName())
                .thenApply(question -> {
                    VerificationChallenge asked = challenge.withQuestion(question);
                    challenges.computeIfPresent(ticket, (t, existing) -> asked);
                    return asked;
                });
    }

    /**
     * Submits the user's answer. Once the acknowledgment arrives the module is
     * verified, provided the dialog is still open.
     *
     * @throws IllegalArgumentException
     *             if the answer is blank or the ticket is unknown
     * @throws IllegalStateException
     *             if the dialog expired or an answer is already being processed
     */
    public CompletableFuture<VerificationOutcome> submitAnswer(String ticket, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("Please provide an answer.");
        }
        VerificationChallenge challenge = requireOpen(ticket);
        if (!submitting.add(ticket)) {
            throw new IllegalStateException("An answer is already being processed");
        }

        return insightService.acknowledge(challenge.goalTitle(), challenge.moduleName(),
                challenge.question(), answer.trim())
                .thenApply(feedback -> {
                    if (!close(challenge)) {
                        log.info("[Verification] Discarding late result for module '{}'", challenge.moduleName());
                        return VerificationOutcome.discarded(feedback);
                    }
                    ExperienceAward award = goalService.verifyModule(challenge.goalId(), challenge.moduleId(),
                            properties.getRewards().getModuleVerification());
                    return new VerificationOutcome(true, feedback, goalService.getProgress(challenge.goalId()),
                            award);
                })
                .whenComplete((outcome, error) -> submitting.remove(ticket));
    }

    /**
     * Completes the module without verification and closes the dialog.
     */
    public VerificationOutcome selfComplete(String ticket) {
        VerificationChallenge challenge = requireOpen(ticket);
        if (submitting.contains(ticket)) {
            throw new IllegalStateException("An answer is already being processed");
        }
        if (!close(challenge)) {
            throw new IllegalStateException("Verification was cancelled or expired");
        }
        ExperienceAward award = goalService.selfCompleteModule(challenge.goalId(), challenge.moduleId(),
                properties.getRewards().getModuleSelfCompletion());
        return new VerificationOutcome(true, null, goalService.getProgress(challenge.goalId()), award);
    }

    /**
     * Abandons the dialog. Results still on their way are dropped.
     */
    public void cancel(String ticket) {
        VerificationChallenge challenge = challenges.remove(ticket);
        if (challenge != null) {
            inFlightRegistry.release(key(challenge.moduleId()), ticket);
            log.info("[Verification] Cancelled for module '{}'", challenge.moduleName());
        }
    }

    public boolean isInProgress(String moduleId) {
        return inFlightRegistry.isHeld(key(moduleId));
    }

    private VerificationChallenge requireOpen(String ticket) {
        VerificationChallenge challenge = challenges.get(ticket);
        if (challenge == null) {
            throw new IllegalArgumentException("Unknown verification ticket: " + ticket);
        }
        if (!inFlightRegistry.isCurrent(key(challenge.moduleId()), ticket)) {
            challenges.remove(ticket);
            throw new IllegalStateException("Verification was cancelled or expired");
        }
        return challenge;
    }

    /**
     * Closes the dialog and reports whether this caller won its token. Only the
     * winner may apply a result.
     */
    private boolean close(VerificationChallenge challenge) {
        challenges.remove(challenge.ticket());
        return inFlightRegistry.release(key(challenge.moduleId()), challenge.ticket());
    }

    private void evictStaleChallenges() {
        challenges.values().removeIf(c -> !inFlightRegistry.isCurrent(key(c.moduleId()), c.ticket()));
    }

    private static String key(String moduleId) {
        return KEY_PREFIX + moduleId;
    }
}
