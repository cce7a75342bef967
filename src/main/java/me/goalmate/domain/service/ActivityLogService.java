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
import me.goalmate.domain.model.CheckInCountEntry;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.XpLogEntry;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Maintains the per-day chart logs (cumulative experience and check-in counts).
 * Each log holds one entry per calendar date; later writes on the same date
 * merge into the existing entry. The logs are derived data and never drive
 * leveling or streak decisions.
 */
@Service
@Slf4j
public class ActivityLogService {

    private final GoalMateSession session;
    private final GoalMateProperties properties;

    public ActivityLogService(GoalMateSession session, GoalMateProperties properties) {
        this.session = session;
        this.properties = properties;
    }

    public void recordExperience(LocalDate date, long cumulativeXp) {
        synchronized (session.getLock()) {
            List<XpLogEntry> entries = session.getXpLog();
            XpLogEntry entry = findByDate(entries, date, XpLogEntry::getDate);
            if (entry != null) {
                entry.setCumulativeXp(cumulativeXp);
            } else {
                entries.add(new XpLogEntry(date, cumulativeXp));
                trim(entries);
            }
        }
    }

    public void incrementCheckIns(LocalDate date) {
        synchronized (session.getLock()) {
            List<CheckInCountEntry> entries = session.getCheckInLog();
            CheckInCountEntry entry = findByDate(entries, date, CheckInCountEntry::getDate);
            if (entry != null) {
                entry.setCount(entry.getCount() + 1);
            } else {
                entries.add(new CheckInCountEntry(date, 1));
                trim(entries);
            }
        }
    }

    public List<XpLogEntry> getXpLog() {
        synchronized (session.getLock()) {
            return session.getXpLog().stream()
                    .map(e -> new XpLogEntry(e.getDate(), e.getCumulativeXp()))
                    .toList();
        }
    }

    public List<CheckInCountEntry> getCheckInLog() {
        synchronized (session.getLock()) {
            return session.getCheckInLog().stream()
                    .map(e -> new CheckInCountEntry(e.getDate(), e.getCount()))
                    .toList();
        }
    }

    private <T> T findByDate(List<T> entries, LocalDate date, Function<T, LocalDate> dateOf) {
        // newest entries are at the tail
        for (int i = entries.size() - 1; i >= 0; i--) {
            T entry = entries.get(i);
            if (date.equals(dateOf.apply(entry))) {
                return entry;
            }
        }
        return null;
    }

    private void trim(List<?> entries) {
        int maxEntries = properties.getActivityLog().getMaxEntries();
        while (maxEntries > 0 && entries.size() > maxEntries) {
            Object dropped = entries.remove(0);
            log.debug("[Activity] Dropped oldest log entry {}", dropped);
        }
    }
}
