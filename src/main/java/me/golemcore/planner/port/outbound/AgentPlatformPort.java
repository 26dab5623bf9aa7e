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

package me.golemcore.planner.port.outbound;

import me.golemcore.planner.domain.model.AgentDefinition;
import me.golemcore.planner.domain.model.RemoteMessage;
import me.golemcore.planner.domain.model.RemoteRun;
import me.golemcore.planner.domain.model.ToolApproval;

import java.util.List;

/**
 * Port for the remote conversational agent platform. Every method is a single
 * blocking remote call that either returns or throws
 * {@link me.golemcore.planner.domain.exception.AgentPlatformException}.
 */
public interface AgentPlatformPort {

    /**
     * Upload a dataset file for use by vector indexes.
     *
     * @param fileName
     *            name reported to the platform
     * @param content
     *            file bytes
     * @return the file id
     */
    String uploadFile(String fileName, byte[] content);

    /**
     * Create a vector index over one uploaded file and wait until it is usable.
     *
     * @return the index id
     */
    String createVectorIndex(String name, String fileId);

    /**
     * Look up an existing agent.
     */
    AgentDefinition.ConnectedAgent getAgent(String agentId);

    String createAgent(AgentDefinition definition);

    String createThread();

    void postMessage(String threadId, String role, String text);

    RemoteRun createRun(String threadId, String agentId);

    RemoteRun getRun(String threadId, String runId);

    /**
     * List the thread's messages. The listing order is not guaranteed to be
     * creation order.
     */
    List<RemoteMessage> listMessages(String threadId);

    void submitToolApprovals(String threadId, String runId, List<ToolApproval> approvals);

    void deleteAgent(String agentId);

    void deleteVectorIndex(String vectorIndexId);

    void deleteFile(String fileId);
}
