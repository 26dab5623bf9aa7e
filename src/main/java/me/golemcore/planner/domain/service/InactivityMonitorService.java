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
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Triggers cleanup of a session's remote resources once the session has been
 * idle for longer than the configured threshold. Invoked on every render and
 * periodically by {@link InactivitySweeper}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InactivityMonitorService {

    private final CleanupService cleanupService;
    private final PlannerProperties properties;
    private final Clock clock;

    public boolean checkAndMaybeCleanup(SessionState state) {
        return checkAndMaybeCleanup(state,
                Duration.ofMinutes(properties.getSession().getInactivityTimeoutMinutes()));
    }

    /**
     * @return true if cleanup was invoked
     */
    public boolean checkAndMaybeCleanup(SessionState state, Duration threshold) {
        Instant now = clock.instant();
        synchronized (state) {
            Instant lastActivity = state.getLastActivity();
            if (lastActivity == null) {
                state.setLastActivity(now);
                return false;
            }
            if (Duration.between(lastActivity, now).compareTo(threshold) <= 0) {
                return false;
            }
        }
        // A turn in flight refreshed lastActivity when it started; it is not idle.
        if (state.getTurnLock().isLocked()) {
            return false;
        }

        log.info("[Inactivity] Session {} idle for more than {} min, cleaning up", state.getKey(),
                threshold.toMinutes());
        cleanupService.cleanup(state);
        synchronized (state) {
            state.setLastActivity(clock.instant());
        }
        return true;
    }
}
