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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session record of the remote resources provisioned for the session and
 * of the conversation held with the agent.
 *
 * <p>
 * A state is owned by exactly one session key. Field updates happen while
 * holding the instance monitor, in short blocks that never span a remote call.
 * The conversation driver additionally holds {@link #getTurnLock()} for the
 * whole duration of a turn, which keeps turns sequential without blocking
 * readers.
 *
 * <p>
 * {@code agentId}, {@code vectorIndexId} and {@code uploadedFileId} are set
 * together when provisioning succeeds. Cleanup may later clear them
 * independently: an identifier survives only when its deletion failed.
 */
@Data
@Builder
public class SessionState {

    private String key;

    private String agentId;
    private String vectorIndexId;
    private String uploadedFileId;

    private String threadId;
    private String runId;

    @Builder.Default
    private List<ChatEntry> messageLog = new ArrayList<>();

    private Instant lastActivity;
    private Instant createdAt;

    private boolean cleanedUp;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private ReentrantLock turnLock = new ReentrantLock();

    public boolean hasAgent() {
        return agentId != null;
    }

    /**
     * True while any remote resource identifier is still held, including
     * leftovers from a failed deletion.
     */
    public boolean holdsResources() {
        return agentId != null || vectorIndexId != null || uploadedFileId != null;
    }

    public ProvisionedResources getResources() {
        return ProvisionedResources.builder()
                .agentId(agentId)
                .vectorIndexId(vectorIndexId)
                .fileId(uploadedFileId)
                .build();
    }

    public void applyResources(ProvisionedResources resources) {
        this.agentId = resources.getAgentId();
        this.vectorIndexId = resources.getVectorIndexId();
        this.uploadedFileId = resources.getFileId();
    }

    public void append(ChatEntry entry) {
        if (messageLog == null) {
            messageLog = new ArrayList<>();
        }
        messageLog.add(entry);
    }

    /**
     * Drops the local conversation (thread, run, log). Remote resources and a
     * run still in flight on the platform are left alone.
     */
    public void resetConversation() {
        threadId = null;
        runId = null;
        messageLog = new ArrayList<>();
    }
}
