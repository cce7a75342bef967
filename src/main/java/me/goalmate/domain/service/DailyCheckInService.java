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
import me.goalmate.domain.model.DailyCheckInResult;
import me.goalmate.domain.model.ExperienceAward;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.PersistenceFailureException;
import me.goalmate.infrastructure.config.GoalMateProperties;
import me.goalmate.port.outbound.CheckInLogPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Once-a-day dashboard check-in backed by the external check-in log.
 *
 * <p>
 * Local state is withheld until the log confirms the write: only then are the
 * checked-in flag, the check-in counter and the experience reward applied. A
 * failed write leaves everything unchanged and surfaces as a
 * {@link PersistenceFailureException}, so the user can retry.
 */
@Service
@Slf4j
public class DailyCheckInService {

    static final String IN_FLIGHT_KEY = "daily-check-in";
    static final String FAILURE_MESSAGE = "Sorry, there was a problem saving your check-in. Please try again later.";

    private final GoalMateSession session;
    private final CheckInLogPort checkInLogPort;
    private final InFlightRegistry inFlightRegistry;
    private final LevelingService levelingService;
    private final ActivityLogService activityLogService;
    private final GoalMateProperties properties;
    private final Clock clock;

    public DailyCheckInService(GoalMateSession session, CheckInLogPort checkInLogPort,
            InFlightRegistry inFlightRegistry, LevelingService levelingService,
            ActivityLogService activityLogService, GoalMateProperties properties, Clock clock) {
        this.session = session;
        this.checkInLogPort = checkInLogPort;
        this.inFlightRegistry = inFlightRegistry;
        this.levelingService = levelingService;
        this.activityLogService = activityLogService;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isCheckedInToday() {
        synchronized (session.getLock()) {
            return session.isDailyCheckInDone(LocalDate.now(clock));
        }
    }

    /**
     * Records today's check-in.
     *
     * @throws IllegalStateException
     *             if today is already checked in or a check-in is pending
     */
    public CompletableFuture<DailyCheckInResult> checkIn() {
        LocalDate today = LocalDate.now(clock);
        if (isCheckedInToday()) {
            throw new IllegalStateException("Already checked in today");
        }
        String token = inFlightRegistry.acquire(IN_FLIGHT_KEY);
        String userId = properties.getCheckIn().getUserId();

        CompletableFuture<Void> stored;
        try {
            stored = checkInLogPort.recordCheckIn(userId, Instant.now(clock));
        } catch (RuntimeException e) {
            stored = CompletableFuture.failedFuture(e);
        }

        return stored.handle((ignored, error) -> {
            try {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("[CheckIn] Saving check-in failed: {}", cause.getMessage());
                    throw new PersistenceFailureException(FAILURE_MESSAGE, cause);
                }
                return commit(today);
            } finally {
                inFlightRegistry.release(IN_FLIGHT_KEY, token);
            }
        });
    }

    private DailyCheckInResult commit(LocalDate date) {
        synchronized (session.getLock()) {
            if (session.isDailyCheckInDone(date)) {
                throw new IllegalStateException("Already checked in today");
            }
            session.markDailyCheckIn(date);
            activityLogService.incrementCheckIns(date);
            ExperienceAward award = levelingService.awardExperience(properties.getRewards().getDailyCheckIn());
            log.info("[CheckIn] Daily check-in logged for {}, +{} XP", date, award.amount());
            return new DailyCheckInResult(date, award);
        }
    }
}
