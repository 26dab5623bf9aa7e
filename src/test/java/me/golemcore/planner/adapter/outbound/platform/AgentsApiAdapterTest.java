package me.golemcore.planner.adapter.outbound.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.planner.domain.exception.AgentPlatformException;
import me.golemcore.planner.domain.exception.ConfigurationException;
import me.golemcore.planner.domain.model.AgentDefinition;
import me.golemcore.planner.domain.model.RemoteMessage;
import me.golemcore.planner.domain.model.RemoteRun;
import me.golemcore.planner.domain.model.RunStatus;
import me.golemcore.planner.domain.model.ToolApproval;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentsApiAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");
    private static final String ENDPOINT = "https://planner.test/api/projects/dinner";

    private OkHttpMockEngine engine;
    private PlannerProperties properties;
    private Clock clock;
    private ObjectMapper objectMapper;
    private List<Long> pauses;
    private AgentsApiAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new PlannerProperties();
        properties.getPlatform().setEndpoint(ENDPOINT);
        properties.getPlatform().setApiKey("secret");
        properties.getPlatform().setApiVersion("2025-05-15-preview");
        properties.getPlatform().setPollIntervalMs(250);
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        objectMapper = new ObjectMapper();
        pauses = new ArrayList<>();

        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new AgentsApiAdapter(properties, client, objectMapper, clock) {
            @Override
            protected void sleepBeforePoll(long millis) {
                pauses.add(millis);
            }
        };
    }

    @Test
    void shouldUploadDatasetAsMultipartForm() {
        engine.enqueueJson(200, "{\"id\":\"file-1\"}");

        String fileId = adapter.uploadFile("dinner_dataset_1.jsonl",
                "{\"doc_id\":\"1\"}\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("file-1", fileId);
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/api/projects/dinner/files", request.path());
        assertEquals("2025-05-15-preview", request.queryParameter("api-version"));
        assertEquals("Bearer secret", request.header("Authorization"));
        assertTrue(request.contentType().startsWith("multipart/form-data"));
        assertTrue(request.body().contains("assistants"));
        assertTrue(request.body().contains("filename=\"dinner_dataset_1.jsonl\""));
    }

    @Test
    void shouldOmitAuthorizationWithoutApiKey() {
        properties.getPlatform().setApiKey("");
        engine.enqueueJson(200, "{\"id\":\"thread-1\"}");

        adapter.createThread();

        assertNull(engine.takeRequest().header("Authorization"));
    }

    @Test
    void shouldPollVectorIndexUntilCompleted() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"vs-1\",\"status\":\"in_progress\"}");
        engine.enqueueJson(200, "{\"id\":\"vs-1\",\"status\":\"in_progress\"}");
        engine.enqueueJson(200, "{\"id\":\"vs-1\",\"status\":\"completed\"}");

        String indexId = adapter.createVectorIndex("dingen_vectorstore_1", "file-1");

        assertEquals("vs-1", indexId);
        List<OkHttpMockEngine.CapturedRequest> requests = engine.takeAll();
        assertEquals(3, requests.size());
        JsonNode payload = objectMapper.readTree(requests.get(0).body());
        assertEquals("dingen_vectorstore_1", payload.path("name").asText());
        assertEquals("file-1", payload.path("file_ids").get(0).asText());
        assertEquals("GET", requests.get(1).method());
        assertEquals("/api/projects/dinner/vector_stores/vs-1", requests.get(2).path());
        assertEquals(List.of(250L, 250L), pauses);
    }

    @Test
    void shouldFailWhenVectorIndexingFails() {
        engine.enqueueJson(200, "{\"id\":\"vs-1\",\"status\":\"failed\"}");

        AgentPlatformException error = assertThrows(AgentPlatformException.class,
                () -> adapter.createVectorIndex("index", "file-1"));

        assertEquals("createVectorIndex", error.getOperation());
        assertTrue(error.getMessage().contains("failed"));
    }

    @Test
    void shouldGiveUpWhenVectorIndexNeverCompletes() {
        properties.getPlatform().setVectorIndexTimeoutSeconds(60);
        when(clock.instant()).thenReturn(NOW, NOW.plusSeconds(30), NOW.plusSeconds(61));
        engine.enqueueJson(200, "{\"id\":\"vs-1\",\"status\":\"in_progress\"}");
        engine.enqueueJson(200, "{\"id\":\"vs-1\",\"status\":\"in_progress\"}");

        AgentPlatformException error = assertThrows(AgentPlatformException.class,
                () -> adapter.createVectorIndex("index", "file-1"));

        assertTrue(error.getMessage().contains("not ready after 60s"));
        assertEquals(1, pauses.size());
    }

    @Test
    void shouldBuildAgentPayloadWithAllCapabilities() {
        AgentDefinition definition = AgentDefinition.builder()
                .name("dinner-planning-agent")
                .model("gpt-4o")
                .instructions("Plan dinners")
                .description("Weekly planner")
                .vectorIndexId("vs-1")
                .connectedAgent(AgentDefinition.ConnectedAgent.builder()
                        .id("asst-mail").name("mailer").description("Sends emails").build())
                .retrievalServer(AgentDefinition.RetrievalServer.builder()
                        .label("google_sheets").url("https://tools.test/mcp")
                        .allowedTools(List.of("get_recipes", "search_recipes")).build())
                .build();

        ObjectNode payload = adapter.buildAgentPayload(definition);

        JsonNode tools = payload.path("tools");
        assertEquals(3, tools.size());
        assertEquals("file_search", tools.get(0).path("type").asText());
        assertEquals("asst-mail", tools.get(1).path("connected_agent").path("id").asText());
        assertEquals("mcp", tools.get(2).path("type").asText());
        assertEquals("google_sheets", tools.get(2).path("server_label").asText());
        assertEquals(2, tools.get(2).path("allowed_tools").size());
        assertEquals("vs-1",
                payload.path("tool_resources").path("file_search").path("vector_store_ids").get(0).asText());
    }

    @Test
    void shouldBuildAgentPayloadWithFileSearchOnly() {
        AgentDefinition definition = AgentDefinition.builder()
                .name("agent").model("gpt-4o").instructions("x").vectorIndexId("vs-1").build();

        ObjectNode payload = adapter.buildAgentPayload(definition);

        assertEquals(1, payload.path("tools").size());
        assertFalse(payload.has("description"));
    }

    @Test
    void shouldLookUpConnectedAgent() {
        engine.enqueueJson(200, "{\"id\":\"asst-mail\",\"name\":\"mailer\",\"description\":null}");

        AgentDefinition.ConnectedAgent agent = adapter.getAgent("asst-mail");

        assertEquals("mailer", agent.getName());
        assertNull(agent.getDescription());
        assertEquals("/api/projects/dinner/assistants/asst-mail", engine.takeRequest().path());
    }

    @Test
    void shouldParseRunWithPendingApprovals() {
        engine.enqueueJson(200, """
                {"id":"run-1","thread_id":"thread-1","status":"requires_action",
                 "required_action":{"type":"submit_tool_approval","submit_tool_approval":{"tool_calls":[
                   {"id":"call-1","type":"mcp","name":"get_recipes","arguments":"{}","server_label":"google_sheets"}
                 ]}}}
                """);

        RemoteRun run = adapter.getRun("thread-1", "run-1");

        assertEquals(RunStatus.REQUIRES_ACTION, run.getStatus());
        assertEquals(1, run.getPendingToolCalls().size());
        assertEquals("call-1", run.getPendingToolCalls().get(0).getId());
        assertTrue(run.getPendingToolCalls().get(0).isRetrievalToolCall());
        assertEquals("/api/projects/dinner/threads/thread-1/runs/run-1", engine.takeRequest().path());
    }

    @Test
    void shouldParseRunFailureReason() {
        engine.enqueueJson(200, """
                {"id":"run-1","status":"failed","last_error":{"code":"rate_limit_exceeded","message":null}}
                """);

        RemoteRun run = adapter.createRun("thread-1", "asst-1");

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals("rate_limit_exceeded", run.getLastError());
        assertEquals("thread-1", run.getThreadId());
    }

    @Test
    void shouldPageThroughThreadMessages() {
        engine.enqueueJson(200, """
                {"data":[{"id":"m1","role":"user","run_id":null,"created_at":100,
                          "content":[{"type":"text","text":{"value":"Plan my week"}}]}],
                 "last_id":"m1","has_more":true}
                """);
        engine.enqueueJson(200, """
                {"data":[{"id":"m2","role":"assistant","run_id":"run-1","created_at":101,
                          "content":[{"type":"text","text":{"value":"Monday: soup"}},
                                     {"type":"image_file","image_file":{"file_id":"f"}},
                                     {"type":"text","text":{"value":"Tuesday: tacos"}}]}],
                 "last_id":"m2","has_more":false}
                """);

        List<RemoteMessage> messages = adapter.listMessages("thread-1");

        assertEquals(2, messages.size());
        assertEquals("Monday: soup\nTuesday: tacos", messages.get(1).getText());
        assertEquals("run-1", messages.get(1).getRunId());
        assertEquals(Instant.ofEpochSecond(101), messages.get(1).getCreatedAt());
        assertNull(messages.get(0).getRunId());

        OkHttpMockEngine.CapturedRequest first = engine.takeRequest();
        assertEquals("asc", first.queryParameter("order"));
        assertNull(first.queryParameter("after"));
        assertEquals("m1", engine.takeRequest().queryParameter("after"));
    }

    @Test
    void shouldSubmitToolApprovals() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"run-1\",\"status\":\"in_progress\"}");

        adapter.submitToolApprovals("thread-1", "run-1", List.of(ToolApproval.approve("call-1")));

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/api/projects/dinner/threads/thread-1/runs/run-1/submit_tool_outputs", request.path());
        JsonNode approval = objectMapper.readTree(request.body()).path("tool_approvals").get(0);
        assertEquals("call-1", approval.path("tool_call_id").asText());
        assertTrue(approval.path("approve").asBoolean());
    }

    @Test
    void shouldReportHttpStatusOnDeleteFailure() {
        engine.enqueueJson(404, "{\"error\":{\"message\":\"No assistant found\"}}");

        AgentPlatformException error = assertThrows(AgentPlatformException.class,
                () -> adapter.deleteAgent("asst-1"));

        assertTrue(error.isNotFound());
        assertEquals("deleteAgent", error.getOperation());
        assertTrue(error.getMessage().contains("No assistant found"));
        assertEquals("DELETE", engine.takeRequest().method());
    }

    @Test
    void shouldWrapTransportFailures() {
        engine.enqueueFailure(new IOException("connection refused"));

        AgentPlatformException error = assertThrows(AgentPlatformException.class,
                () -> adapter.deleteFile("file-1"));

        assertEquals(0, error.getStatus());
        assertTrue(error.getMessage().contains("connection refused"));
    }

    @Test
    void shouldRejectMissingEndpoint() {
        properties.getPlatform().setEndpoint("not a url");

        assertThrows(ConfigurationException.class, () -> adapter.deleteVectorIndex("vs-1"));
        assertTrue(engine.takeAll().isEmpty());
    }
}
