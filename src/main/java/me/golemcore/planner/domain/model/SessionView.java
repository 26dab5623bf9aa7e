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

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a session taken under its monitor, plus the readiness
 * status computed by the last render.
 */
@Data
@Builder
public class SessionView {

    private String key;
    private Status status;
    private String error;
    private String agentId;
    private String vectorIndexId;
    private String uploadedFileId;
    private String threadId;
    private String runId;
    private List<ChatEntry> messages;
    private Instant lastActivity;
    private boolean cleanedUp;

    public static SessionView of(SessionState state, Status status, String error) {
        synchronized (state) {
            return SessionView.builder()
                    .key(state.getKey())
                    .status(status)
                    .error(error)
                    .agentId(state.getAgentId())
                    .vectorIndexId(state.getVectorIndexId())
                    .uploadedFileId(state.getUploadedFileId())
                    .threadId(state.getThreadId())
                    .runId(state.getRunId())
                    .messages(List.copyOf(state.getMessageLog()))
                    .lastActivity(state.getLastActivity())
                    .cleanedUp(state.isCleanedUp())
                    .build();
        }
    }

    public enum Status {
        READY, NOT_PROVISIONED, PROVISIONING, CLEANED, FAILED
    }
}
