package me.goalmate.infrastructure.config;


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

import lombok.Data;
import me.goalmate.domain.model.Proof;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code goalmate.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - generative-text provider settings</li>
 * <li>{@link RewardProperties} - experience granted per user action</li>
 * <li>{@link HabitProperties} - habit defaults</li>
 * <li>{@link ActivityLogProperties} - chart log retention</li>
 * <li>{@link InsightProperties} - provider call budgets</li>
 * <li>{@link VerificationProperties} - in-flight ticket lifetime</li>
 * <li>{@link StorageProperties} - local workspace for the check-in log</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "goalmate")
@Data
public class GoalMateProperties {

    private LlmProperties llm = new LlmProperties();
    private RewardProperties rewards = new RewardProperties();
    private HabitProperties habits = new HabitProperties();
    private ActivityLogProperties activityLog = new ActivityLogProperties();
    private InsightProperties insight = new InsightProperties();
    private VerificationProperties verification = new VerificationProperties();
    private CheckInProperties checkIn = new CheckInProperties();
    private BuddyProperties buddy = new BuddyProperties();
    private StorageProperties storage = new StorageProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** Model in {@code provider/model} form, e.g. {@code openai/gpt-4o-mini}. */
        private String model = "openai/gpt-4o-mini";
        private double temperature = 0.7;
        private int maxTokens = 1024;
        private long timeoutMs = 30000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== REWARDS ====================

    @Data
    public static class RewardProperties {
        private int moduleVerification = 10;
        private int moduleSelfCompletion = 0;
        private int dailyCheckIn = 10;
        private int screenshotProof = 10;
        private int linkProof = 10;
        private int unverifiedProof = 0;

        /**
         * Experience granted for a habit check-in with the given proof kind.
         */
        public int forProof(Proof.ProofKind kind) {
            return switch (kind) {
                case SCREENSHOT -> screenshotProof;
                case LINK -> linkProof;
                case UNVERIFIED, FROZEN -> unverifiedProof;
            };
        }
    }

    // ==================== HABITS ====================

    @Data
    public static class HabitProperties {
        private int defaultFreezeTokens = 1;
    }

    @Data
    public static class ActivityLogProperties {
        private int maxEntries = 60;
    }

    // ==================== PROVIDER CALLS ====================

    @Data
    public static class InsightProperties {
        private Duration timeout = Duration.ofSeconds(15);
    }

    @Data
    public static class VerificationProperties {
        private Duration ticketTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class CheckInProperties {
        private String userId = "local-user";
    }

    @Data
    public static class BuddyProperties {
        private String name = "Alex Taylor";
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.goalmate/workspace";
    }
}
