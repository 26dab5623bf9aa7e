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

package me.golemcore.planner.adapter.outbound.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.planner.domain.exception.AgentPlatformException;
import me.golemcore.planner.domain.exception.ConfigurationException;
import me.golemcore.planner.domain.model.AgentDefinition;
import me.golemcore.planner.domain.model.PendingToolCall;
import me.golemcore.planner.domain.model.RemoteMessage;
import me.golemcore.planner.domain.model.RemoteRun;
import me.golemcore.planner.domain.model.RunStatus;
import me.golemcore.planner.domain.model.ToolApproval;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.AgentPlatformPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent platform adapter for the assistants-style REST API served by Azure AI
 * Foundry agent projects.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /files - upload the dataset (purpose {@code assistants})
 * <li>POST /vector_stores, GET /vector_stores/{id} - index and wait
 * <li>GET, POST, DELETE /assistants - agents
 * <li>POST /threads, /threads/{t}/messages, /threads/{t}/runs - conversation
 * <li>POST /threads/{t}/runs/{r}/submit_tool_outputs - tool approvals
 * </ul>
 *
 * <p>
 * Every request carries the {@code api-version} query parameter and, when a key
 * is configured, a bearer {@code Authorization} header. Non-2xx responses and
 * I/O failures raise {@link AgentPlatformException}.
 */
@Component
@Slf4j
public class AgentsApiAdapter implements AgentPlatformPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType JSONL = MediaType.get("application/jsonl");
    private static final String FILE_PURPOSE = "assistants";
    private static final int MESSAGE_PAGE_SIZE = 100;

    private final PlannerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AgentsApiAdapter(PlannerProperties properties, OkHttpClient okHttpClient, ObjectMapper objectMapper,
            Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = okHttpClient;
    }

    // ==================== FILES & INDEXES ====================

    @Override
    public String uploadFile(String fileName, byte[] content) {
        MultipartBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("purpose", FILE_PURPOSE)
                .addFormDataPart("file", fileName, RequestBody.create(content, JSONL))
                .build();
        JsonNode response = execute("uploadFile", requestBuilder(url("files")).post(body));
        return requireId("uploadFile", response);
    }

    @Override
    public String createVectorIndex(String name, String fileId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("name", name);
        payload.putArray("file_ids").add(fileId);

        JsonNode created = execute("createVectorIndex", requestBuilder(url("vector_stores")).post(json(payload)));
        String indexId = requireId("createVectorIndex", created);
        awaitIndexed(indexId, created);
        return indexId;
    }

    private void awaitIndexed(String indexId, JsonNode current) {
        PlannerProperties.PlatformProperties platform = properties.getPlatform();
        Duration timeout = Duration.ofSeconds(platform.getVectorIndexTimeoutSeconds());
        Instant deadline = clock.instant().plus(timeout);

        JsonNode store = current;
        while (true) {
            String status = store.path("status").asText("");
            if ("completed".equals(status)) {
                log.debug("[Platform] Vector index {} completed", indexId);
                return;
            }
            if ("expired".equals(status) || "failed".equals(status) || "cancelled".equals(status)) {
                throw new AgentPlatformException("createVectorIndex", 0,
                        "vector index " + indexId + " ended with status " + status);
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new AgentPlatformException("createVectorIndex", 0,
                        "vector index " + indexId + " not ready after " + timeout.toSeconds() + "s");
            }
            sleepBeforePoll(platform.getPollIntervalMs());
            store = execute("getVectorIndex", requestBuilder(url("vector_stores", indexId)).get());
        }
    }

    // ==================== AGENTS ====================

    @Override
    public AgentDefinition.ConnectedAgent getAgent(String agentId) {
        JsonNode agent = execute("getAgent", requestBuilder(url("assistants", agentId)).get());
        return AgentDefinition.ConnectedAgent.builder()
                .id(agent.path("id").asText(agentId))
                .name(textOrNull(agent, "name"))
                .description(textOrNull(agent, "description"))
                .build();
    }

    @Override
    public String createAgent(AgentDefinition definition) {
        JsonNode response = execute("createAgent",
                requestBuilder(url("assistants")).post(json(buildAgentPayload(definition))));
        return requireId("createAgent", response);
    }

    ObjectNode buildAgentPayload(AgentDefinition definition) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", definition.getModel());
        payload.put("name", definition.getName());
        payload.put("instructions", definition.getInstructions());
        if (definition.getDescription() != null) {
            payload.put("description", definition.getDescription());
        }

        ArrayNode tools = payload.putArray("tools");
        tools.addObject().put("type", "file_search");

        AgentDefinition.ConnectedAgent connected = definition.getConnectedAgent();
        if (connected != null) {
            ObjectNode tool = tools.addObject();
            tool.put("type", "connected_agent");
            ObjectNode details = tool.putObject("connected_agent");
            details.put("id", connected.getId());
            details.put("name", connected.getName());
            details.put("description", connected.getDescription());
        }

        AgentDefinition.RetrievalServer server = definition.getRetrievalServer();
        if (server != null) {
            ObjectNode tool = tools.addObject();
            tool.put("type", "mcp");
            tool.put("server_label", server.getLabel());
            tool.put("server_url", server.getUrl());
            ArrayNode allowed = tool.putArray("allowed_tools");
            server.getAllowedTools().forEach(allowed::add);
        }

        payload.putObject("tool_resources")
                .putObject("file_search")
                .putArray("vector_store_ids")
                .add(definition.getVectorIndexId());
        return payload;
    }

    // ==================== THREADS & RUNS ====================

    @Override
    public String createThread() {
        JsonNode response = execute("createThread",
                requestBuilder(url("threads")).post(json(objectMapper.createObjectNode())));
        return requireId("createThread", response);
    }

    @Override
    public void postMessage(String threadId, String role, String text) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("role", role);
        payload.put("content", text);
        execute("postMessage", requestBuilder(url("threads", threadId, "messages")).post(json(payload)));
    }

    @Override
    public RemoteRun createRun(String threadId, String agentId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("assistant_id", agentId);
        JsonNode run = execute("createRun", requestBuilder(url("threads", threadId, "runs")).post(json(payload)));
        return toRun(threadId, run);
    }

    @Override
    public RemoteRun getRun(String threadId, String runId) {
        JsonNode run = execute("getRun", requestBuilder(url("threads", threadId, "runs", runId)).get());
        return toRun(threadId, run);
    }

    @Override
    public List<RemoteMessage> listMessages(String threadId) {
        List<RemoteMessage> messages = new ArrayList<>();
        String after = null;
        while (true) {
            HttpUrl.Builder pageUrl = url("threads", threadId, "messages").newBuilder()
                    .addQueryParameter("order", "asc")
                    .addQueryParameter("limit", String.valueOf(MESSAGE_PAGE_SIZE));
            if (after != null) {
                pageUrl.addQueryParameter("after", after);
            }
            JsonNode page = execute("listMessages", requestBuilder(pageUrl.build()).get());
            for (JsonNode message : page.path("data")) {
                messages.add(toMessage(message));
            }
            String lastId = textOrNull(page, "last_id");
            if (!page.path("has_more").asBoolean(false) || lastId == null) {
                return messages;
            }
            after = lastId;
        }
    }

    @Override
    public void submitToolApprovals(String threadId, String runId, List<ToolApproval> approvals) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode items = payload.putArray("tool_approvals");
        for (ToolApproval approval : approvals) {
            items.addObject()
                    .put("tool_call_id", approval.getToolCallId())
                    .put("approve", approval.isApprove());
        }
        execute("submitToolApprovals",
                requestBuilder(url("threads", threadId, "runs", runId, "submit_tool_outputs")).post(json(payload)));
    }

    // ==================== DELETION ====================

    @Override
    public void deleteAgent(String agentId) {
        execute("deleteAgent", requestBuilder(url("assistants", agentId)).delete());
    }

    @Override
    public void deleteVectorIndex(String vectorIndexId) {
        execute("deleteVectorIndex", requestBuilder(url("vector_stores", vectorIndexId)).delete());
    }

    @Override
    public void deleteFile(String fileId) {
        execute("deleteFile", requestBuilder(url("files", fileId)).delete());
    }

    protected void sleepBeforePoll(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentPlatformException("createVectorIndex", "interrupted while waiting", e);
        }
    }

    // ==================== HTTP ====================

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private JsonNode execute(String operation, Request.Builder builder) {
        Request request = builder.build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Platform] {} {} returned HTTP {}", request.method(), request.url().encodedPath(),
                        response.code());
                throw new AgentPlatformException(operation, response.code(), extractError(content));
            }
            if (content.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new AgentPlatformException(operation, "unparseable response", e);
        } catch (IOException e) {
            log.warn("[Platform] {} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
            throw new AgentPlatformException(operation, e.getMessage(), e);
        }
    }

    private Request.Builder requestBuilder(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        String apiKey = properties.getPlatform().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private HttpUrl url(String... segments) {
        PlannerProperties.PlatformProperties platform = properties.getPlatform();
        String endpoint = platform.getEndpoint();
        HttpUrl base = endpoint != null ? HttpUrl.parse(endpoint.trim()) : null;
        if (base == null) {
            throw new ConfigurationException("planner.platform.endpoint is missing or not a valid URL");
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.addQueryParameter("api-version", platform.getApiVersion()).build();
    }

    private RequestBody json(JsonNode payload) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request", e);
        }
    }

    // ==================== PARSING ====================

    private RemoteRun toRun(String threadId, JsonNode run) {
        JsonNode lastError = run.path("last_error");
        String error = null;
        if (lastError.isObject()) {
            error = textOrNull(lastError, "message");
            if (error == null) {
                error = textOrNull(lastError, "code");
            }
        } else if (lastError.isTextual()) {
            error = lastError.asText();
        }

        return RemoteRun.builder()
                .id(run.path("id").asText(null))
                .threadId(run.path("thread_id").asText(threadId))
                .status(RunStatus.fromWire(run.path("status").asText(null)))
                .lastError(error)
                .pendingToolCalls(parsePendingCalls(run.path("required_action")))
                .build();
    }

    private List<PendingToolCall> parsePendingCalls(JsonNode requiredAction) {
        List<PendingToolCall> calls = new ArrayList<>();
        if (!requiredAction.isObject()) {
            return calls;
        }
        JsonNode toolCalls = requiredAction.path("submit_tool_approval").path("tool_calls");
        if (!toolCalls.isArray()) {
            toolCalls = requiredAction.path("submit_tool_outputs").path("tool_calls");
        }
        for (JsonNode call : toolCalls) {
            calls.add(PendingToolCall.builder()
                    .id(textOrNull(call, "id"))
                    .type(textOrNull(call, "type"))
                    .name(call.has("name") ? textOrNull(call, "name") : textOrNull(call.path("function"), "name"))
                    .arguments(textOrNull(call, "arguments"))
                    .serverLabel(textOrNull(call, "server_label"))
                    .build());
        }
        return calls;
    }

    private RemoteMessage toMessage(JsonNode message) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : message.path("content")) {
            if (!"text".equals(part.path("type").asText())) {
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(part.path("text").path("value").asText(""));
        }

        JsonNode createdAt = message.path("created_at");
        return RemoteMessage.builder()
                .id(textOrNull(message, "id"))
                .runId(textOrNull(message, "run_id"))
                .role(textOrNull(message, "role"))
                .text(text.toString())
                .createdAt(createdAt.isNumber() ? Instant.ofEpochSecond(createdAt.asLong()) : null)
                .build();
    }

    private String requireId(String operation, JsonNode response) {
        String id = textOrNull(response, "id");
        if (id == null) {
            throw new AgentPlatformException(operation, 0, "response carries no id");
        }
        return id;
    }

    private String extractError(String content) {
        if (content == null || content.isBlank()) {
            return "empty response";
        }
        try {
            JsonNode node = objectMapper.readTree(content);
            JsonNode error = node.path("error");
            if (error.isObject() && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (error.isTextual()) {
                return error.asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("[Platform] Error body is not JSON");
        }
        return content.length() > 300 ? content.substring(0, 300) + "..." : content;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNull() || value.isMissingNode() ? null : value.asText();
    }
}
