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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.planner.domain.exception.ConfigurationException;
import me.golemcore.planner.domain.exception.ProvisioningException;
import me.golemcore.planner.domain.model.AgentDefinition;
import me.golemcore.planner.domain.model.CleanupReport;
import me.golemcore.planner.domain.model.DatasetRecord;
import me.golemcore.planner.domain.model.ProvisionedResources;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.AgentPlatformPort;
import me.golemcore.planner.tools.DinnerHistoryTool;
import me.golemcore.planner.tools.RecipeSearchTool;
import me.golemcore.planner.tools.RecipesTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * Creates the remote resources backing one session: dataset file, vector index
 * over it, and an agent that searches the index.
 *
 * <p>
 * The three creations form a saga. If a later step fails, resources created by
 * earlier steps are deleted before the failure is reported, so a failed
 * provisioning leaves nothing behind unless the rollback itself fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResourceProvisioningService {

    static final String STEP_UPLOAD = "upload";
    static final String STEP_INDEX = "vector-index";
    static final String STEP_AGENT = "agent";

    private static final String FALLBACK_INSTRUCTIONS = "You are a helpful dinner planning assistant. "
            + "Use the recipe catalog and the recent dinner history to plan dinners for the coming week.";

    private final AgentPlatformPort platformPort;
    private final CleanupService cleanupService;
    private final PlannerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile String cachedInstructions;

    /**
     * Provision the resources for {@code dataset}.
     *
     * @throws IllegalArgumentException
     *             if the dataset is empty
     * @throws ConfigurationException
     *             if the platform endpoint is not configured
     * @throws ProvisioningException
     *             if any step fails; carries the resources that could not be
     *             rolled back
     */
    public ProvisionedResources provision(List<DatasetRecord> dataset) {
        if (dataset == null || dataset.isEmpty()) {
            throw new IllegalArgumentException("Cannot provision an agent over an empty dataset");
        }
        PlannerProperties.PlatformProperties platform = properties.getPlatform();
        if (platform.getEndpoint() == null || platform.getEndpoint().isBlank()) {
            throw new ConfigurationException("planner.platform.endpoint is not configured");
        }

        long epochSeconds = clock.instant().getEpochSecond();
        ProvisionedResources created = new ProvisionedResources();

        String step = STEP_UPLOAD;
        try {
            byte[] payload = serialize(dataset);
            String fileId = platformPort.uploadFile("dinner_dataset_" + epochSeconds + ".jsonl", payload);
            created.setFileId(fileId);
            log.info("[Provision] Uploaded dataset file {} ({} records)", fileId, dataset.size());

            step = STEP_INDEX;
            String indexId = platformPort.createVectorIndex("dingen_vectorstore_" + epochSeconds, fileId);
            created.setVectorIndexId(indexId);
            log.info("[Provision] Vector index {} ready", indexId);

            step = STEP_AGENT;
            String agentId = platformPort.createAgent(buildDefinition(indexId));
            created.setAgentId(agentId);
            log.info("[Provision] Created agent {}", agentId);
            return created;
        } catch (RuntimeException e) {
            log.warn("[Provision] Failed at step {}: {}", step, e.getMessage());
            throw new ProvisioningException(step, rollback(created), e);
        }
    }

    private ProvisionedResources rollback(ProvisionedResources created) {
        if (created.isEmpty()) {
            return new ProvisionedResources();
        }
        CleanupReport report = cleanupService.deleteResources(created);
        ProvisionedResources orphaned = ProvisionedResources.builder()
                .agentId(report.isAgentDeleted() ? null : created.getAgentId())
                .vectorIndexId(report.isVectorIndexDeleted() ? null : created.getVectorIndexId())
                .fileId(report.isFileDeleted() ? null : created.getFileId())
                .build();
        if (!orphaned.isEmpty()) {
            log.warn("[Provision] Rollback left resources behind: {}", orphaned);
        }
        return orphaned;
    }

    AgentDefinition buildDefinition(String vectorIndexId) {
        PlannerProperties.PlatformProperties platform = properties.getPlatform();
        AgentDefinition.AgentDefinitionBuilder builder = AgentDefinition.builder()
                .name(platform.getAgentName())
                .model(platform.getModel())
                .description(platform.getDescription())
                .instructions(loadInstructions())
                .vectorIndexId(vectorIndexId)
                .connectedAgent(resolveConnectedAgent(platform.getConnectedAgentId()));

        String serverUrl = platform.getRetrievalServerUrl();
        if (serverUrl != null && !serverUrl.isBlank()) {
            builder.retrievalServer(AgentDefinition.RetrievalServer.builder()
                    .label(platform.getRetrievalServerLabel())
                    .url(serverUrl)
                    .allowedTools(List.of(RecipesTool.NAME, DinnerHistoryTool.NAME, RecipeSearchTool.NAME))
                    .build());
        }
        return builder.build();
    }

    private AgentDefinition.ConnectedAgent resolveConnectedAgent(String connectedAgentId) {
        if (connectedAgentId == null || connectedAgentId.isBlank()) {
            log.warn("[Provision] Email agent not configured, plans cannot be emailed");
            return null;
        }
        try {
            AgentDefinition.ConnectedAgent agent = platformPort.getAgent(connectedAgentId);
            if (agent.getDescription() == null || agent.getDescription().isBlank()) {
                agent.setDescription("Sends emails on behalf of the user");
            }
            return agent;
        } catch (RuntimeException e) { // NOSONAR - the planner works without the email agent
            log.warn("[Provision] Email agent {} unavailable, continuing without it: {}", connectedAgentId,
                    e.getMessage());
            return null;
        }
    }

    private String loadInstructions() {
        String instructions = cachedInstructions;
        if (instructions != null) {
            return instructions;
        }
        String location = properties.getPlatform().getInstructionsResource();
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            instructions = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[Provision] Instructions resource {} not readable, using built-in text: {}", location,
                    e.getMessage());
            instructions = FALLBACK_INSTRUCTIONS;
        }
        cachedInstructions = instructions;
        return instructions;
    }

    /**
     * One JSON object per line with {@code doc_id}, {@code content},
     * {@code _source} and {@code raw_metadata}.
     */
    byte[] serialize(List<DatasetRecord> dataset) {
        StringBuilder ndjson = new StringBuilder();
        try {
            for (DatasetRecord item : dataset) {
                ObjectNode node = objectMapper.createObjectNode();
                node.put("doc_id", item.getId());
                node.put("content", item.getText());
                node.put("_source", item.getOrigin());
                node.set("raw_metadata", objectMapper.valueToTree(item.getMetadata()));
                ndjson.append(objectMapper.writeValueAsString(node)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dataset", e);
        }
        return ndjson.toString().getBytes(StandardCharsets.UTF_8);
    }
}
