package me.golemcore.planner.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.planner.domain.exception.AgentPlatformException;
import me.golemcore.planner.domain.exception.ConfigurationException;
import me.golemcore.planner.domain.exception.ProvisioningException;
import me.golemcore.planner.domain.model.AgentDefinition;
import me.golemcore.planner.domain.model.DatasetRecord;
import me.golemcore.planner.domain.model.ProvisionedResources;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.AgentPlatformPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ResourceProvisioningServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");
    private static final long EPOCH = NOW.getEpochSecond();

    private AgentPlatformPort platformPort;
    private PlannerProperties properties;
    private ResourceProvisioningService service;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        platformPort = mock(AgentPlatformPort.class);
        properties = new PlannerProperties();
        properties.getPlatform().setEndpoint("https://example.services.ai.azure.com/api/projects/demo");
        service = new ResourceProvisioningService(platformPort, new CleanupService(platformPort), properties,
                objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));

        when(platformPort.uploadFile(anyString(), any())).thenReturn("file-1");
        when(platformPort.createVectorIndex(anyString(), eq("file-1"))).thenReturn("vs-1");
        when(platformPort.createAgent(any())).thenReturn("agent-1");
    }

    @Test
    void shouldProvisionFileIndexAndAgent() {
        ProvisionedResources resources = service.provision(dataset());

        assertEquals("file-1", resources.getFileId());
        assertEquals("vs-1", resources.getVectorIndexId());
        assertEquals("agent-1", resources.getAgentId());
        verify(platformPort).uploadFile(eq("dinner_dataset_" + EPOCH + ".jsonl"), any());
        verify(platformPort).createVectorIndex("dingen_vectorstore_" + EPOCH, "file-1");
    }

    @Test
    void shouldUploadOneJsonObjectPerRecord() throws Exception {
        service.provision(dataset());

        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(platformPort).uploadFile(anyString(), captor.capture());
        String[] lines = new String(captor.getValue(), StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);

        JsonNode first = objectMapper.readTree(lines[0]);
        assertEquals("0", first.get("doc_id").asText());
        assertEquals("Pasta pesto Summer", first.get("content").asText());
        assertEquals("recipes", first.get("_source").asText());
        assertEquals("Pasta pesto", first.get("raw_metadata").get("Dish").asText());
        assertEquals("dinner_history", objectMapper.readTree(lines[1]).get("_source").asText());
    }

    @Test
    void shouldBindAgentToIndexWithInstructions() {
        service.provision(dataset());

        AgentDefinition definition = capturedDefinition();
        assertEquals("vs-1", definition.getVectorIndexId());
        assertEquals("gpt-4o", definition.getModel());
        assertEquals("dinner-planning-agent", definition.getName());
        assertTrue(definition.getInstructions().contains("7 days"));
        assertNull(definition.getConnectedAgent());
        assertNull(definition.getRetrievalServer());
    }

    @Test
    void shouldRejectEmptyDataset() {
        assertThrows(IllegalArgumentException.class, () -> service.provision(List.of()));
        verifyNoInteractions(platformPort);
    }

    @Test
    void shouldFailFastWithoutEndpoint() {
        properties.getPlatform().setEndpoint(" ");

        assertThrows(ConfigurationException.class, () -> service.provision(dataset()));
        verifyNoInteractions(platformPort);
    }

    @Test
    void shouldRollBackUpstreamResourcesWhenAgentCreationFails() {
        when(platformPort.createAgent(any())).thenThrow(new AgentPlatformException("createAgent", 400, "bad"));

        ProvisioningException error = assertThrows(ProvisioningException.class,
                () -> service.provision(dataset()));

        assertEquals("agent", error.getStep());
        assertTrue(error.getOrphaned().isEmpty());
        verify(platformPort).deleteVectorIndex("vs-1");
        verify(platformPort).deleteFile("file-1");
        verify(platformPort, never()).deleteAgent(anyString());
    }

    @Test
    void shouldReportResourcesWhoseRollbackFailed() {
        when(platformPort.createVectorIndex(anyString(), anyString()))
                .thenThrow(new AgentPlatformException("createVectorIndex", 0, "indexing failed"));
        doThrow(new AgentPlatformException("deleteFile", 503, "unavailable")).when(platformPort).deleteFile("file-1");

        ProvisioningException error = assertThrows(ProvisioningException.class,
                () -> service.provision(dataset()));

        assertEquals("vector-index", error.getStep());
        assertEquals("file-1", error.getOrphaned().getFileId());
        assertNull(error.getOrphaned().getVectorIndexId());
        verify(platformPort, never()).createAgent(any());
    }

    @Test
    void shouldNotRollBackAnythingWhenUploadFails() {
        when(platformPort.uploadFile(anyString(), any()))
                .thenThrow(new AgentPlatformException("uploadFile", 413, "too large"));

        ProvisioningException error = assertThrows(ProvisioningException.class,
                () -> service.provision(dataset()));

        assertEquals("upload", error.getStep());
        verify(platformPort, never()).deleteFile(anyString());
    }

    @Test
    void shouldAttachConnectedEmailAgent() {
        properties.getPlatform().setConnectedAgentId("email-agent");
        when(platformPort.getAgent("email-agent")).thenReturn(AgentDefinition.ConnectedAgent.builder()
                .id("email-agent").name("email_sender").description("Sends mail").build());

        service.provision(dataset());

        AgentDefinition.ConnectedAgent connected = capturedDefinition().getConnectedAgent();
        assertNotNull(connected);
        assertEquals("email_sender", connected.getName());
    }

    @Test
    void shouldContinueWithoutEmailAgentWhenLookupFails() {
        properties.getPlatform().setConnectedAgentId("email-agent");
        when(platformPort.getAgent("email-agent")).thenThrow(new AgentPlatformException("getAgent", 404, "gone"));

        ProvisionedResources resources = service.provision(dataset());

        assertEquals("agent-1", resources.getAgentId());
        assertNull(capturedDefinition().getConnectedAgent());
    }

    @Test
    void shouldRestrictRetrievalServerToPlannerTools() {
        properties.getPlatform().setRetrievalServerUrl("https://tools.example.com/mcp");

        service.provision(dataset());

        AgentDefinition.RetrievalServer server = capturedDefinition().getRetrievalServer();
        assertEquals("google_sheets", server.getLabel());
        assertEquals(List.of("get_recipes", "get_dinner_history", "search_recipes"), server.getAllowedTools());
    }

    @Test
    void shouldFallBackToBuiltInInstructionsWhenResourceMissing() {
        properties.getPlatform().setInstructionsResource("prompts/does-not-exist.md");

        service.provision(dataset());

        assertTrue(capturedDefinition().getInstructions().startsWith("You are a helpful dinner planning"));
    }

    private AgentDefinition capturedDefinition() {
        ArgumentCaptor<AgentDefinition> captor = ArgumentCaptor.forClass(AgentDefinition.class);
        verify(platformPort).createAgent(captor.capture());
        return captor.getValue();
    }

    private static List<DatasetRecord> dataset() {
        return List.of(
                DatasetRecord.builder()
                        .id("0")
                        .text("Pasta pesto Summer")
                        .origin(DatasetRecord.ORIGIN_RECIPES)
                        .metadata(Map.of("Dish", "Pasta pesto"))
                        .build(),
                DatasetRecord.builder()
                        .id("0")
                        .text("Taco Friday")
                        .origin(DatasetRecord.ORIGIN_DINNER_HISTORY)
                        .metadata(Map.of("Dish", "Taco"))
                        .build());
    }
}
