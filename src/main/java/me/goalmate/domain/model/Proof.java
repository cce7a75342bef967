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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Evidence attached to a check-in. {@code value} holds a data URL for
 * screenshots or a URL for links.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Proof {

    private ProofKind kind;
    private String value;
    private String comment;

    public static Proof unverified(String comment) {
        return new Proof(ProofKind.UNVERIFIED, null, comment);
    }

    public static Proof frozen() {
        return new Proof(ProofKind.FROZEN, null, null);
    }

    @JsonIgnore
    public boolean hasValue() {
        return value != null && !value.isBlank();
    }

    /**
     * Proof kinds. Screenshot and link require a payload.
     */
    public enum ProofKind {
        SCREENSHOT, LINK, UNVERIFIED, FROZEN;

        public boolean requiresValue() {
            return this == SCREENSHOT || this == LINK;
        }
    }
}
