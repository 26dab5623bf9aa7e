package me.golemcore.planner.domain.service;

import me.golemcore.planner.domain.model.SessionState;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class InactivityMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");

    private CleanupService cleanupService;
    private InactivityMonitorService monitor;

    @BeforeEach
    void setUp() {
        cleanupService = mock(CleanupService.class);
        PlannerProperties properties = new PlannerProperties();
        properties.getSession().setInactivityTimeoutMinutes(10);
        monitor = new InactivityMonitorService(cleanupService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCleanUpSessionIdleLongerThanThreshold() {
        SessionState state = state(NOW.minus(Duration.ofMinutes(11)));

        boolean cleaned = monitor.checkAndMaybeCleanup(state);

        assertTrue(cleaned);
        verify(cleanupService, times(1)).cleanup(state);
        assertEquals(NOW, state.getLastActivity());
    }

    @Test
    void shouldNotCleanUpSessionIdleShorterThanThreshold() {
        SessionState state = state(NOW.minus(Duration.ofMinutes(9)));

        assertFalse(monitor.checkAndMaybeCleanup(state));
        verify(cleanupService, never()).cleanup(any());
    }

    @Test
    void shouldNotCleanUpAtExactThreshold() {
        SessionState state = state(NOW.minus(Duration.ofMinutes(10)));

        assertFalse(monitor.checkAndMaybeCleanup(state));
    }

    @Test
    void shouldInitializeMissingLastActivityWithoutCleanup() {
        SessionState state = state(null);

        assertFalse(monitor.checkAndMaybeCleanup(state));
        assertEquals(NOW, state.getLastActivity());
        verify(cleanupService, never()).cleanup(any());
    }

    @Test
    void shouldUseExplicitThreshold() {
        SessionState state = state(NOW.minus(Duration.ofMinutes(3)));

        assertTrue(monitor.checkAndMaybeCleanup(state, Duration.ofMinutes(2)));
    }

    @Test
    void shouldSkipSessionWithTurnInFlight() throws Exception {
        SessionState state = state(NOW.minus(Duration.ofMinutes(30)));
        Thread holder = new Thread(() -> state.getTurnLock().lock());
        holder.start();
        holder.join();

        assertFalse(monitor.checkAndMaybeCleanup(state));
        verify(cleanupService, never()).cleanup(any());
    }

    private SessionState state(Instant lastActivity) {
        return SessionState.builder()
                .key("s1")
                .agentId("a1")
                .lastActivity(lastActivity)
                .build();
    }
}
