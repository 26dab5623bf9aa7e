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

package me.golemcore.planner.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of an agent to create on the platform. The agent always gets a
 * file search capability over {@code vectorIndexId}; the connected agent and
 * the retrieval server are optional.
 */
@Data
@Builder
public class AgentDefinition {

    private String name;
    private String model;
    private String instructions;
    private String description;
    private String vectorIndexId;
    private ConnectedAgent connectedAgent;
    private RetrievalServer retrievalServer;

    /**
     * Pre-existing agent that the new agent may delegate to (email sending).
     */
    @Data
    @Builder
    public static class ConnectedAgent {
        private String id;
        private String name;
        private String description;
    }

    /**
     * Remote tool host reachable by the platform; its calls need approval.
     */
    @Data
    @Builder
    public static class RetrievalServer {
        private String label;
        private String url;
        @Builder.Default
        private List<String> allowedTools = new ArrayList<>();
    }
}
