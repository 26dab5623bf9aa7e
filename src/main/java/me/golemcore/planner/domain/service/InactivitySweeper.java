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
import me.golemcore.planner.port.outbound.SessionPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic inactivity check across all stored sessions, so idle resources are
 * released even when nobody renders the session again.
 *
 * <p>
 * Each tick runs the {@link InactivityMonitorService} on sessions that still
 * hold remote resources and evicts sessions that hold none and have been idle
 * longer than {@code planner.session.eviction-minutes}. Sessions whose
 * resources were deleted on request are never evicted; only an explicit
 * discard forgets them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InactivitySweeper {

    private final SessionPort sessionPort;
    private final InactivityMonitorService inactivityMonitor;
    private final PlannerProperties properties;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    @PostConstruct
    public void init() {
        int intervalSeconds = properties.getSession().getSweepIntervalSeconds();
        if (intervalSeconds <= 0) {
            log.info("[Inactivity] Background sweep disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "inactivity-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep, intervalSeconds, intervalSeconds,
                TimeUnit.SECONDS);
        log.info("[Inactivity] Sweeping sessions every {}s", intervalSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    void sweep() {
        Duration eviction = Duration.ofMinutes(properties.getSession().getEvictionMinutes());
        int cleaned = 0;
        int evicted = 0;
        for (SessionState state : sessionPort.listAll()) {
            try {
                if (state.holdsResources()) {
                    if (inactivityMonitor.checkAndMaybeCleanup(state)) {
                        cleaned++;
                    }
                } else if (isEvictable(state, eviction) && sessionPort.remove(state.getKey(), state)) {
                    evicted++;
                }
            } catch (Exception e) { // NOSONAR - one broken session must not stop the sweep
                log.warn("[Inactivity] Sweep failed for session {}: {}", state.getKey(), e.getMessage());
            }
        }
        if (cleaned > 0 || evicted > 0) {
            log.info("[Inactivity] Sweep cleaned {} and evicted {} sessions", cleaned, evicted);
        }
    }

    private boolean isEvictable(SessionState state, Duration eviction) {
        if (state.getTurnLock().isLocked()) {
            return false;
        }
        Instant reference;
        synchronized (state) {
            // Cleaned sessions stay stored so their key is not provisioned again.
            if (state.isCleanedUp()) {
                return false;
            }
            reference = state.getLastActivity() != null ? state.getLastActivity() : state.getCreatedAt();
        }
        return reference != null && Duration.between(reference, clock.instant()).compareTo(eviction) > 0;
    }
}
