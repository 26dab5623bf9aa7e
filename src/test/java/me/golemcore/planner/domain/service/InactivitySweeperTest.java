package me.golemcore.planner.domain.service;

import me.golemcore.planner.domain.model.SessionState;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.SessionPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InactivitySweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");

    private SessionStoreService store;
    private InactivityMonitorService monitor;
    private PlannerProperties properties;
    private InactivitySweeper sweeper;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new SessionStoreService(clock);
        monitor = mock(InactivityMonitorService.class);
        properties = new PlannerProperties();
        properties.getSession().setEvictionMinutes(120);
        properties.getSession().setSweepIntervalSeconds(0);
        sweeper = new InactivitySweeper(store, monitor, properties, clock);
    }

    @AfterEach
    void tearDown() {
        sweeper.shutdown();
    }

    @Test
    void shouldCheckSessionsHoldingResources() {
        SessionState state = store.getOrCreate("s1");
        state.setAgentId("agent-1");

        sweeper.sweep();

        verify(monitor).checkAndMaybeCleanup(state);
    }

    @Test
    void shouldEvictIdleSessionWithoutResources() {
        SessionState state = store.getOrCreate("s1");
        state.setLastActivity(NOW.minus(Duration.ofMinutes(121)));

        sweeper.sweep();

        assertTrue(store.get("s1").isEmpty());
        verify(monitor, never()).checkAndMaybeCleanup(any(SessionState.class));
    }

    @Test
    void shouldKeepCleanedSessionPastEvictionWindow() {
        SessionState state = store.getOrCreate("s1");
        state.setCleanedUp(true);
        state.setLastActivity(NOW.minus(Duration.ofMinutes(121)));

        sweeper.sweep();

        assertTrue(store.get("s1").isPresent());
    }

    @Test
    void shouldEvictOnlyTheSessionItInspected() {
        SessionState stale = SessionState.builder()
                .key("s1")
                .createdAt(NOW.minus(Duration.ofMinutes(200)))
                .lastActivity(NOW.minus(Duration.ofMinutes(121)))
                .build();
        SessionPort sessionPort = mock(SessionPort.class);
        when(sessionPort.listAll()).thenReturn(List.of(stale));
        when(sessionPort.remove("s1", stale)).thenReturn(false);
        InactivitySweeper isolated = new InactivitySweeper(sessionPort, monitor, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        try {
            isolated.sweep();
        } finally {
            isolated.shutdown();
        }

        verify(sessionPort).remove("s1", stale);
        verify(sessionPort, never()).remove(anyString());
    }

    @Test
    void shouldKeepRecentlyActiveSessionWithoutResources() {
        SessionState state = store.getOrCreate("s1");
        state.setLastActivity(NOW.minus(Duration.ofMinutes(30)));

        sweeper.sweep();

        assertTrue(store.get("s1").isPresent());
    }

    @Test
    void shouldKeepSweepingWhenOneSessionFails() {
        SessionState broken = store.getOrCreate("broken");
        broken.setAgentId("agent-1");
        SessionState healthy = store.getOrCreate("healthy");
        healthy.setAgentId("agent-2");
        when(monitor.checkAndMaybeCleanup(broken)).thenThrow(new IllegalStateException("boom"));

        sweeper.sweep();

        verify(monitor).checkAndMaybeCleanup(healthy);
    }

    @Test
    void shouldNotScheduleWhenIntervalDisabled() {
        sweeper.init();

        verify(monitor, never()).checkAndMaybeCleanup(any(SessionState.class));
    }
}
