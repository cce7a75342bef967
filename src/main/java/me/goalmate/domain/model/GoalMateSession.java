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

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-writer state of one user session: profile, goals, habits and chart
 * logs. Domain services hold it by reference and mutate it only while holding
 * {@link #getLock()}.
 */
@Getter
public class GoalMateSession {

    private final Object lock = new Object();

    private final UserProfile profile = UserProfile.builder().build();
    private final List<Goal> goals = new ArrayList<>();
    private final List<Habit> habits = new ArrayList<>();
    private final List<XpLogEntry> xpLog = new ArrayList<>();
    private final List<CheckInCountEntry> checkInLog = new ArrayList<>();

    private LocalDate lastDailyCheckIn;

    public boolean isDailyCheckInDone(LocalDate today) {
        return today.equals(lastDailyCheckIn);
    }

    public void markDailyCheckIn(LocalDate date) {
        this.lastDailyCheckIn = date;
    }
}
