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

import me.golemcore.planner.domain.exception.AgentPlatformException;
import me.golemcore.planner.domain.model.CleanupReport;
import me.golemcore.planner.domain.model.ProvisionedResources;
import me.golemcore.planner.domain.model.SessionState;
import me.golemcore.planner.port.outbound.AgentPlatformPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Deletes the remote resources of a session on a best-effort, all-attempt
 * basis: every present identifier gets exactly one deletion attempt, and one
 * failure never prevents the others.
 *
 * <p>
 * Deletion runs agent first, then vector index, then file, i.e. reverse
 * dependency order. A resource the platform no longer knows (404) counts as
 * deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CleanupService {

    private final AgentPlatformPort platformPort;

    /**
     * Delete the resources recorded in {@code state} and clear the identifiers
     * of those that were deleted. Failed ones stay in the state for a later
     * attempt. Remote calls are made without holding the state's monitor.
     */
    public CleanupReport cleanup(SessionState state) {
        ProvisionedResources targets;
        synchronized (state) {
            targets = state.getResources();
        }
        if (targets.isEmpty()) {
            return CleanupReport.nothingDeleted();
        }

        CleanupReport report = deleteResources(targets);

        synchronized (state) {
            if (report.isAgentDeleted() && Objects.equals(state.getAgentId(), targets.getAgentId())) {
                state.setAgentId(null);
            }
            if (report.isVectorIndexDeleted()
                    && Objects.equals(state.getVectorIndexId(), targets.getVectorIndexId())) {
                state.setVectorIndexId(null);
            }
            if (report.isFileDeleted() && Objects.equals(state.getUploadedFileId(), targets.getFileId())) {
                state.setUploadedFileId(null);
            }
        }
        log.info("[Cleanup] Session {}: {}/3 resources deleted", state.getKey(), report.successCount());
        return report;
    }

    /**
     * Delete whichever of the given resources are present.
     */
    public CleanupReport deleteResources(ProvisionedResources targets) {
        return CleanupReport.builder()
                .agentDeleted(attempt("agent", targets.getAgentId(), platformPort::deleteAgent))
                .vectorIndexDeleted(attempt("vector index", targets.getVectorIndexId(),
                        platformPort::deleteVectorIndex))
                .fileDeleted(attempt("file", targets.getFileId(), platformPort::deleteFile))
                .build();
    }

    private boolean attempt(String kind, String id, Consumer<String> deletion) {
        if (id == null) {
            return false;
        }
        try {
            deletion.accept(id);
            log.info("[Cleanup] Deleted {} {}", kind, id);
            return true;
        } catch (AgentPlatformException e) {
            if (e.isNotFound()) {
                log.info("[Cleanup] {} {} already gone", kind, id);
                return true;
            }
            log.warn("[Cleanup] Failed to delete {} {}: {}", kind, id, e.getMessage());
            return false;
        } catch (RuntimeException e) { // NOSONAR - one failed deletion must not stop the others
            log.warn("[Cleanup] Failed to delete {} {}: {}: {}", kind, id, e.getClass().getSimpleName(),
                    e.getMessage());
            return false;
        }
    }
}
