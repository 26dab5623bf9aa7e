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

package me.golemcore.planner.domain.service;

import me.golemcore.planner.domain.model.SessionState;
import me.golemcore.planner.port.outbound.SessionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session store keyed by session key. States live for the lifetime
 * of the process; {@link InactivitySweeper} evicts the ones that no longer hold
 * remote resources and have been idle past the eviction window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStoreService implements SessionPort {

    private final Clock clock;

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    @Override
    public SessionState getOrCreate(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("Session key is required");
        }
        return sessions.computeIfAbsent(sessionKey, key -> {
            log.info("[Sessions] Created session {}", key);
            return SessionState.builder()
                    .key(key)
                    .createdAt(clock.instant())
                    .build();
        });
    }

    @Override
    public Optional<SessionState> get(String sessionKey) {
        if (sessionKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionKey));
    }

    @Override
    public SessionState create() {
        return getOrCreate(UUID.randomUUID().toString());
    }

    @Override
    public void remove(String sessionKey) {
        if (sessions.remove(sessionKey) != null) {
            log.info("[Sessions] Removed session {}", sessionKey);
        }
    }

    @Override
    public boolean remove(String sessionKey, SessionState expected) {
        if (sessionKey == null || expected == null) {
            return false;
        }
        // Identity check, SessionState equality is by value.
        boolean[] removed = new boolean[1];
        sessions.computeIfPresent(sessionKey, (key, current) -> {
            if (current == expected) {
                removed[0] = true;
                return null;
            }
            return current;
        });
        if (removed[0]) {
            log.info("[Sessions] Removed session {}", sessionKey);
        }
        return removed[0];
    }

    @Override
    public List<SessionState> listAll() {
        return List.copyOf(sessions.values());
    }
}
