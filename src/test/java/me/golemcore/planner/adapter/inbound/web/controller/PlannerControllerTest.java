package me.golemcore.planner.adapter.inbound.web.controller;

import me.golemcore.planner.adapter.inbound.web.dto.SendMessageRequest;
import me.golemcore.planner.domain.model.ChatEntry;
import me.golemcore.planner.domain.model.CleanupReport;
import me.golemcore.planner.domain.model.ConversationTurn;
import me.golemcore.planner.domain.model.SessionView;
import me.golemcore.planner.domain.service.PlannerSessionService;
import me.golemcore.planner.domain.service.RecipeDatasetService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlannerControllerTest {

    private static final String KEY = "session-1";

    private PlannerSessionService sessionService;
    private RecipeDatasetService datasetService;
    private PlannerController controller;

    @BeforeEach
    void setUp() {
        sessionService = mock(PlannerSessionService.class);
        datasetService = mock(RecipeDatasetService.class);
        controller = new PlannerController(sessionService, datasetService);
    }

    @Test
    void shouldCreateSession() {
        when(sessionService.createSession()).thenReturn(view(SessionView.Status.NOT_PROVISIONED, List.of()));

        StepVerifier.create(controller.createSession())
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals(KEY, response.getBody().getKey());
                    assertEquals("NOT_PROVISIONED", response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldRenderSessionWithLowercaseRoles() {
        when(sessionService.render(KEY)).thenReturn(view(SessionView.Status.READY,
                List.of(ChatEntry.user("Plan my week"), ChatEntry.assistant("Monday: soup"))));

        StepVerifier.create(controller.renderSession(KEY))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("READY", response.getBody().getStatus());
                    assertEquals("agent-1", response.getBody().getAgentId());
                    assertEquals("user", response.getBody().getMessages().get(0).getRole());
                    assertEquals("assistant", response.getBody().getMessages().get(1).getRole());
                    assertEquals("2026-03-01T18:00:00Z", response.getBody().getLastActivity());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnTurnWithRefreshedSession() {
        when(sessionService.sendMessage(KEY, "Plan my week")).thenReturn(ConversationTurn.builder()
                .outcome(ConversationTurn.Outcome.COMPLETED)
                .runId("run-1")
                .responses(List.of("Monday: soup"))
                .build());
        when(sessionService.describe(KEY)).thenReturn(view(SessionView.Status.READY,
                List.of(ChatEntry.user("Plan my week"), ChatEntry.assistant("Monday: soup"))));

        SendMessageRequest request = new SendMessageRequest();
        request.setText("Plan my week");

        StepVerifier.create(controller.sendMessage(KEY, request))
                .assertNext(response -> {
                    assertEquals("COMPLETED", response.getBody().getOutcome());
                    assertEquals(List.of("Monday: soup"), response.getBody().getResponses());
                    assertNull(response.getBody().getError());
                    assertEquals(2, response.getBody().getSession().getMessages().size());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateRejectedMessage() {
        when(sessionService.sendMessage(KEY, null))
                .thenThrow(new IllegalArgumentException("Message text is required"));

        StepVerifier.create(controller.sendMessage(KEY, new SendMessageRequest()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void shouldResetConversation() {
        when(sessionService.resetConversation(KEY)).thenReturn(view(SessionView.Status.READY, List.of()));

        StepVerifier.create(controller.resetConversation(KEY))
                .assertNext(response -> assertTrue(response.getBody().getMessages().isEmpty()))
                .verifyComplete();
    }

    @Test
    void shouldReportDeletedResources() {
        when(sessionService.deleteResources(KEY)).thenReturn(new CleanupReport(true, true, false));
        SessionView cleaned = view(SessionView.Status.CLEANED, List.of());
        cleaned.setCleanedUp(true);
        when(sessionService.describe(KEY)).thenReturn(cleaned);

        StepVerifier.create(controller.deleteResources(KEY))
                .assertNext(response -> {
                    assertTrue(response.getBody().isAgentDeleted());
                    assertTrue(response.getBody().isVectorIndexDeleted());
                    assertFalse(response.getBody().isFileDeleted());
                    assertTrue(response.getBody().getSession().isCleanedUp());
                })
                .verifyComplete();
    }

    @Test
    void shouldDiscardSession() {
        StepVerifier.create(controller.discardSession(KEY))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(sessionService).discardSession(KEY);
    }

    @Test
    void shouldPropagateUnknownSessionOnDiscard() {
        doThrow(new NoSuchElementException("Unknown session: x")).when(sessionService).discardSession("x");

        StepVerifier.create(controller.discardSession("x"))
                .expectError(NoSuchElementException.class)
                .verify();
    }

    @Test
    void shouldReturnRecipesAndHistory() {
        when(datasetService.getRecipes()).thenReturn(List.of(Map.of("Dish", "Soup")));
        when(datasetService.getDinnerHistory()).thenReturn(List.of(Map.of("Dish", "Tacos")));

        StepVerifier.create(controller.getRecipes())
                .assertNext(response -> {
                    assertEquals(1, response.getBody().getRecipes().size());
                    assertEquals("Tacos", response.getBody().getDinnerHistory().get(0).get("Dish"));
                })
                .verifyComplete();
    }

    private static SessionView view(SessionView.Status status, List<ChatEntry> messages) {
        return SessionView.builder()
                .key(KEY)
                .status(status)
                .agentId(status == SessionView.Status.READY ? "agent-1" : null)
                .messages(messages)
                .lastActivity(Instant.parse("2026-03-01T18:00:00Z"))
                .build();
    }
}
