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
 * Snapshot of a run as last reported by the platform.
 */
@Data
@Builder
public class RemoteRun {

    private String id;
    private String threadId;
    private RunStatus status;
    private String lastError;

    /**
     * Tool calls awaiting approval; only populated while the status is
     * {@link RunStatus#REQUIRES_ACTION}.
     */
    @Builder.Default
    private List<PendingToolCall> pendingToolCalls = new ArrayList<>();

    public boolean requiresAction() {
        return status == RunStatus.REQUIRES_ACTION;
    }
}
