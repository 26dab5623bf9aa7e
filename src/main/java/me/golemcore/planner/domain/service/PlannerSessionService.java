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

import me.golemcore.planner.domain.exception.ProvisioningException;
import me.golemcore.planner.domain.exception.SheetsException;
import me.golemcore.planner.domain.model.CleanupReport;
import me.golemcore.planner.domain.model.ConversationTurn;
import me.golemcore.planner.domain.model.DatasetRecord;
import me.golemcore.planner.domain.model.ProvisionedResources;
import me.golemcore.planner.domain.model.SessionState;
import me.golemcore.planner.domain.model.SessionView;
import me.golemcore.planner.port.outbound.SessionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for everything a user session does: render, chat, reset and
 * delete. Each render first checks for inactivity and then provisions the
 * session's resources if it has none yet.
 *
 * <p>
 * At most one provisioning runs per session key. A render that finds another
 * provisioning in flight reports {@link SessionView.Status#PROVISIONING}
 * instead of starting a second one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlannerSessionService {

    private final SessionPort sessionPort;
    private final InactivityMonitorService inactivityMonitor;
    private final ResourceProvisioningService provisioningService;
    private final RecipeDatasetService datasetService;
    private final ConversationService conversationService;
    private final CleanupService cleanupService;
    private final Clock clock;

    private final Set<String> provisioning = ConcurrentHashMap.newKeySet();

    public SessionView createSession() {
        SessionState state = sessionPort.create();
        return render(state.getKey());
    }

    public SessionView render(String sessionKey) {
        SessionState state = sessionPort.getOrCreate(sessionKey);
        inactivityMonitor.checkAndMaybeCleanup(state);
        return ensureProvisioned(state);
    }

    /**
     * Send one user utterance to the session's agent, provisioning it first if
     * needed.
     *
     * @throws IllegalArgumentException
     *             if {@code text} is blank
     * @throws IllegalStateException
     *             if the session was cleaned up or cannot be provisioned
     */
    public ConversationTurn sendMessage(String sessionKey, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text must not be blank");
        }
        SessionState state = sessionPort.getOrCreate(sessionKey);
        inactivityMonitor.checkAndMaybeCleanup(state);

        SessionView view = ensureProvisioned(state);
        switch (view.getStatus()) {
            case READY:
                break;
            case CLEANED:
                throw new IllegalStateException("Session resources were deleted, start a new session");
            case PROVISIONING:
                throw new IllegalStateException("Session is still being provisioned, try again shortly");
            default:
                throw new IllegalStateException("Session is not ready: "
                        + (view.getError() != null ? view.getError() : view.getStatus()));
        }
        return conversationService.send(state, view.getAgentId(), text.trim());
    }

    /**
     * Current view of an existing session, without inactivity check or
     * provisioning.
     */
    public SessionView describe(String sessionKey) {
        SessionState state = sessionPort.get(sessionKey)
                .orElseThrow(() -> new NoSuchElementException("Unknown session: " + sessionKey));
        return SessionView.of(state, currentStatus(state), null);
    }

    public SessionView resetConversation(String sessionKey) {
        SessionState state = sessionPort.getOrCreate(sessionKey);
        synchronized (state) {
            state.resetConversation();
            state.setLastActivity(clock.instant());
        }
        log.info("[Conversation] Session {} conversation reset", sessionKey);
        return SessionView.of(state, currentStatus(state), null);
    }

    /**
     * Delete the session's remote resources and end its conversation. The
     * session stays cleaned up even if some deletions failed; the failed
     * identifiers remain recorded so a later call retries them.
     *
     * @throws NoSuchElementException
     *             if no session is stored under {@code sessionKey}
     */
    public CleanupReport deleteResources(String sessionKey) {
        SessionState state = sessionPort.get(sessionKey)
                .orElseThrow(() -> new NoSuchElementException("Unknown session: " + sessionKey));

        CleanupReport report = cleanupService.cleanup(state);
        synchronized (state) {
            state.resetConversation();
            state.setCleanedUp(true);
            state.setLastActivity(clock.instant());
        }
        if (state.holdsResources()) {
            log.warn("[Cleanup] Session {} still holds {}", sessionKey, state.getResources());
        }
        return report;
    }

    /**
     * Forget a session so its key can start over.
     *
     * @throws NoSuchElementException
     *             if no session is stored under {@code sessionKey}
     * @throws IllegalStateException
     *             if the session still holds remote resource identifiers
     */
    public void discardSession(String sessionKey) {
        SessionState state = sessionPort.get(sessionKey)
                .orElseThrow(() -> new NoSuchElementException("Unknown session: " + sessionKey));
        synchronized (state) {
            if (state.holdsResources()) {
                throw new IllegalStateException("Session " + sessionKey
                        + " still holds remote resources, delete them first");
            }
        }
        sessionPort.remove(sessionKey);
        log.info("[API] Session {} discarded", sessionKey);
    }

    SessionView ensureProvisioned(SessionState state) {
        SessionView.Status early = earlyStatus(state);
        if (early != null) {
            return SessionView.of(state, early, null);
        }

        String key = state.getKey();
        if (!provisioning.add(key)) {
            return SessionView.of(state, SessionView.Status.PROVISIONING, null);
        }
        try {
            early = earlyStatus(state);
            if (early != null) {
                return SessionView.of(state, early, null);
            }
            releaseStrayResources(state);

            List<DatasetRecord> dataset = datasetService.getCombinedDataset();
            ProvisionedResources resources = provisioningService.provision(dataset);
            if (!adoptUnlessCleaned(state, resources)) {
                return SessionView.of(state, SessionView.Status.CLEANED, null);
            }
            log.info("[Provision] Session {} ready with agent {}", key, resources.getAgentId());
            return SessionView.of(state, SessionView.Status.READY, null);
        } catch (ProvisioningException e) {
            log.warn("[Provision] Session {}: {}", key, e.getMessage());
            if (!adoptUnlessCleaned(state, e.getOrphaned())) {
                return SessionView.of(state, SessionView.Status.CLEANED, null);
            }
            return SessionView.of(state, SessionView.Status.FAILED, e.getMessage());
        } catch (SheetsException | IndexOutOfBoundsException | IllegalArgumentException e) {
            log.warn("[Provision] Session {} dataset unavailable: {}", key, e.getMessage());
            return SessionView.of(state, SessionView.Status.FAILED, e.getMessage());
        } finally {
            provisioning.remove(key);
        }
    }

    /**
     * Record freshly created resources on the session unless its resources were
     * deleted while they were being created. In that case the new resources
     * are deleted right away and only the ones that could not be deleted are
     * recorded, so a repeated delete request can retry them.
     *
     * @return false if the session was cleaned up in the meantime
     */
    private boolean adoptUnlessCleaned(SessionState state, ProvisionedResources resources) {
        ProvisionedResources created = resources != null ? resources : new ProvisionedResources();
        synchronized (state) {
            if (!state.isCleanedUp()) {
                state.applyResources(created);
                if (created.getAgentId() != null) {
                    state.setLastActivity(clock.instant());
                }
                return true;
            }
        }
        if (created.isEmpty()) {
            return false;
        }
        log.warn("[Provision] Session {} was cleaned up during provisioning, deleting {}", state.getKey(),
                created);
        CleanupReport report = cleanupService.deleteResources(created);
        synchronized (state) {
            if (!report.isAgentDeleted() && state.getAgentId() == null) {
                state.setAgentId(created.getAgentId());
            }
            if (!report.isVectorIndexDeleted() && state.getVectorIndexId() == null) {
                state.setVectorIndexId(created.getVectorIndexId());
            }
            if (!report.isFileDeleted() && state.getUploadedFileId() == null) {
                state.setUploadedFileId(created.getFileId());
            }
        }
        return false;
    }

    private SessionView.Status earlyStatus(SessionState state) {
        synchronized (state) {
            if (state.isCleanedUp()) {
                return SessionView.Status.CLEANED;
            }
            if (state.hasAgent()) {
                return SessionView.Status.READY;
            }
        }
        return null;
    }

    private SessionView.Status currentStatus(SessionState state) {
        SessionView.Status status = earlyStatus(state);
        if (status != null) {
            return status;
        }
        return provisioning.contains(state.getKey())
                ? SessionView.Status.PROVISIONING
                : SessionView.Status.NOT_PROVISIONED;
    }

    private void releaseStrayResources(SessionState state) {
        boolean stray;
        synchronized (state) {
            stray = state.holdsResources();
        }
        if (!stray) {
            return;
        }
        log.info("[Provision] Session {} has leftovers from an earlier attempt, deleting them", state.getKey());
        cleanupService.cleanup(state);
        synchronized (state) {
            if (state.holdsResources()) {
                log.warn("[Provision] Session {} abandons undeletable resources {}", state.getKey(),
                        state.getResources());
                state.applyResources(new ProvisionedResources());
            }
        }
    }
}
