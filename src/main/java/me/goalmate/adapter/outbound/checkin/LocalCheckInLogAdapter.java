
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

package me.goalmate.adapter.outbound.checkin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.goalmate.port.outbound.CheckInLogPort;
import me.goalmate.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Check-in log kept as JSON lines in the local workspace
 * ({@code checkins/checkins.jsonl}), one {@code {"user_id", "date"}} record per
 * check-in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalCheckInLogAdapter implements CheckInLogPort {

    static final String DIRECTORY = "checkins";
    static final String FILE = "checkins.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Void> recordCheckIn(String userId, Instant timestamp) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("user_id", userId);
        record.put("date", timestamp.toString());

        String line;
        try {
            line = objectMapper.writeValueAsString(record) + "\n";
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        return storagePort.appendText(DIRECTORY, FILE, line)
                .thenRun(() -> log.debug("[CheckIn] Stored check-in for {} at {}", userId, timestamp));
    }
}
