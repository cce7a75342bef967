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
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation tokens for requests that wait on an external call.
 *
 * <p>
 * At most one live token exists per key (e.g. {@code module:<id>},
 * {@code daily-check-in}). A result is applied only if the token it was started
 * with is still current, so cancelled or expired requests drop their late
 * results. Tokens expire after {@code goalmate.verification.ticket-ttl}.
 */
@Component
@Slf4j
public class InFlightRegistry {

    private final Map<String, Ticket> tickets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InFlightRegistry(GoalMateProperties properties, Clock clock) {
        this.clock = clock;
        this.ttl = properties.getVerification().getTicketTtl();
    }

    /**
     * Issues a new token for the key.
     *
     * @throws IllegalStateException
     *             if a live token is already held for the key
     */
    public String acquire(String key) {
        Instant now = Instant.now(clock);
        String token = UUID.randomUUID().toString();
        Ticket issued = tickets.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            if (existing != null) {
                log.debug("[InFlight] Token for {} expired, replacing", k);
            }
            return new Ticket(token, now.plus(ttl));
        });
        if (!issued.token().equals(token)) {
            throw new IllegalStateException("A request is already in progress for " + key);
        }
        return token;
    }

    public boolean isCurrent(String key, String token) {
        Ticket ticket = tickets.get(key);
        return ticket != null
                && Objects.equals(ticket.token(), token)
                && !ticket.isExpired(Instant.now(clock));
    }

    public boolean isHeld(String key) {
        Ticket ticket = tickets.get(key);
        return ticket != null && !ticket.isExpired(Instant.now(clock));
    }

    /**
     * Releases the key if the token still owns it. Exactly one caller can win the
     * release of a token, so a completion that must not race a cancel applies its
     * result only when this returns true.
     *
     * @return true if the token was current (owned and not expired) and is now
     *         released
     */
    public boolean release(String key, String token) {
        Ticket ticket = tickets.get(key);
        if (ticket == null || !ticket.token().equals(token) || !tickets.remove(key, ticket)) {
            return false;
        }
        return !ticket.isExpired(Instant.now(clock));
    }

    private record Ticket(String token, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
