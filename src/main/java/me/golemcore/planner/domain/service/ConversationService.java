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

import me.golemcore.planner.domain.exception.RunTimedOutException;
import me.golemcore.planner.domain.model.ChatEntry;
import me.golemcore.planner.domain.model.ConversationTurn;
import me.golemcore.planner.domain.model.PendingToolCall;
import me.golemcore.planner.domain.model.RemoteMessage;
import me.golemcore.planner.domain.model.RemoteRun;
import me.golemcore.planner.domain.model.RunStatus;
import me.golemcore.planner.domain.model.SessionState;
import me.golemcore.planner.domain.model.ToolApproval;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.AgentPlatformPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one request/response exchange with the session's agent.
 *
 * <p>
 * A turn posts the utterance on the session's thread (created on first use),
 * starts a run and blocks until the run reaches a terminal status or the wait
 * deadline passes. While the run waits for tool approval, pending retrieval
 * tool calls are approved. Responses are the run's messages in creation order.
 *
 * <p>
 * Failures never propagate: they become a single assistant-role entry in the
 * message log and a non-{@code COMPLETED} outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private static final String ROLE_USER = "user";

    private final AgentPlatformPort platformPort;
    private final PlannerProperties properties;
    private final Clock clock;

    public ConversationTurn send(SessionState state, String agentId, String utterance) {
        Objects.requireNonNull(agentId, "agentId");
        ReentrantLock turnLock = state.getTurnLock();
        turnLock.lock();
        try {
            String threadAtStart;
            synchronized (state) {
                state.append(ChatEntry.user(utterance));
                state.setLastActivity(clock.instant());
                threadAtStart = state.getThreadId();
            }

            ConversationTurn turn = executeTurn(state, agentId, utterance);

            synchronized (state) {
                if (isStale(state, threadAtStart, turn.getThreadId())) {
                    log.info("[Conversation] Session {} was reset during run {}, dropping its result",
                            state.getKey(), turn.getRunId());
                    return turn;
                }
                if (turn.getOutcome() == ConversationTurn.Outcome.COMPLETED) {
                    turn.getResponses().forEach(text -> state.append(ChatEntry.assistant(text)));
                } else {
                    state.append(ChatEntry.assistant(turn.getError()));
                }
                state.setLastActivity(clock.instant());
            }
            return turn;
        } finally {
            turnLock.unlock();
        }
    }

    private ConversationTurn executeTurn(SessionState state, String agentId, String utterance) {
        String threadId = null;
        String runId = null;
        try {
            threadId = ensureThread(state);
            platformPort.postMessage(threadId, ROLE_USER, utterance);

            RemoteRun run = platformPort.createRun(threadId, agentId);
            runId = run.getId();
            synchronized (state) {
                if (threadId.equals(state.getThreadId())) {
                    state.setRunId(runId);
                }
            }
            log.debug("[Conversation] Session {} started run {} on thread {}", state.getKey(), runId, threadId);

            RemoteRun finished = awaitTerminal(threadId, run);
            if (finished.getStatus() == RunStatus.COMPLETED) {
                List<String> responses = collectResponses(threadId, runId);
                log.info("[Conversation] Run {} completed with {} responses", runId, responses.size());
                return ConversationTurn.builder()
                        .outcome(ConversationTurn.Outcome.COMPLETED)
                        .threadId(threadId)
                        .runId(runId)
                        .responses(responses)
                        .build();
            }

            String reason = finished.getLastError() != null
                    ? finished.getLastError()
                    : finished.getStatus().name().toLowerCase(Locale.ROOT);
            log.warn("[Conversation] Run {} ended with status {}: {}", runId, finished.getStatus(), reason);
            return failedTurn(ConversationTurn.Outcome.RUN_FAILED, threadId, runId, "Run failed: " + reason);
        } catch (RunTimedOutException e) {
            log.warn("[Conversation] {}", e.getMessage());
            return failedTurn(ConversationTurn.Outcome.TIMED_OUT, threadId, runId,
                    "Agent request timed out: " + e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - every send failure is reported in the chat
            log.warn("[Conversation] Send failed for session {}: {}", state.getKey(), e.getMessage());
            return failedTurn(ConversationTurn.Outcome.SEND_FAILED, threadId, runId,
                    "Agent request failed: " + e.getMessage());
        }
    }

    private String ensureThread(SessionState state) {
        synchronized (state) {
            if (state.getThreadId() != null) {
                return state.getThreadId();
            }
        }
        String threadId = platformPort.createThread();
        synchronized (state) {
            state.setThreadId(threadId);
        }
        log.info("[Conversation] Session {} opened thread {}", state.getKey(), threadId);
        return threadId;
    }

    private RemoteRun awaitTerminal(String threadId, RemoteRun started) {
        PlannerProperties.PlatformProperties platform = properties.getPlatform();
        Duration timeout = Duration.ofSeconds(platform.getRunTimeoutSeconds());
        Instant deadline = clock.instant().plus(timeout);
        Set<String> approvedCalls = new HashSet<>();

        RemoteRun run = started;
        while (!run.getStatus().isTerminal()) {
            if (run.requiresAction()) {
                approvePendingCalls(threadId, run, approvedCalls);
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new RunTimedOutException(run.getId(), timeout);
            }
            pause(platform.getPollIntervalMs());
            run = platformPort.getRun(threadId, run.getId());
        }
        return run;
    }

    private void approvePendingCalls(String threadId, RemoteRun run, Set<String> approvedCalls) {
        List<ToolApproval> approvals = run.getPendingToolCalls().stream()
                .filter(PendingToolCall::isRetrievalToolCall)
                .filter(call -> !approvedCalls.contains(call.getId()))
                .map(call -> ToolApproval.approve(call.getId()))
                .toList();
        if (approvals.isEmpty()) {
            return;
        }
        platformPort.submitToolApprovals(threadId, run.getId(), approvals);
        approvals.forEach(approval -> approvedCalls.add(approval.getToolCallId()));
        log.debug("[Conversation] Approved {} tool calls for run {}", approvals.size(), run.getId());
    }

    private List<String> collectResponses(String threadId, String runId) {
        return platformPort.listMessages(threadId).stream()
                .filter(message -> runId.equals(message.getRunId()))
                .filter(message -> message.getText() != null && !message.getText().isBlank())
                .sorted(Comparator.comparing(RemoteMessage::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(RemoteMessage::getText)
                .toList();
    }

    private boolean isStale(SessionState state, String threadAtStart, String threadUsed) {
        String current = state.getThreadId();
        if (threadUsed == null) {
            return !Objects.equals(current, threadAtStart);
        }
        return !threadUsed.equals(current);
    }

    private ConversationTurn failedTurn(ConversationTurn.Outcome outcome, String threadId, String runId,
            String error) {
        return ConversationTurn.builder()
                .outcome(outcome)
                .threadId(threadId)
                .runId(runId)
                .error(error)
                .build();
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for run", e);
        }
    }
}
