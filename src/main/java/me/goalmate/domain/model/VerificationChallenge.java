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

/**
 * An open verification dialog for one module. {@code ticket} is the operation
 * token every follow-up call must present.
 */
public record VerificationChallenge(String ticket, String goalId, String moduleId, String goalTitle,
        String moduleName, String question) {

    public VerificationChallenge withQuestion(String text) {
        return new VerificationChallenge(ticket, goalId, moduleId, goalTitle, moduleName, text);
    }
}
