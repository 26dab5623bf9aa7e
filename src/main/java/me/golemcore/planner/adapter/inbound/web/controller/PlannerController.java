package me.golemcore.planner.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.planner.adapter.inbound.web.dto.CleanupResponse;
import me.golemcore.planner.adapter.inbound.web.dto.RecipesResponse;
import me.golemcore.planner.adapter.inbound.web.dto.SendMessageRequest;
import me.golemcore.planner.adapter.inbound.web.dto.SessionDto;
import me.golemcore.planner.adapter.inbound.web.dto.TurnResponse;
import me.golemcore.planner.domain.model.ChatEntry;
import me.golemcore.planner.domain.model.CleanupReport;
import me.golemcore.planner.domain.model.ConversationTurn;
import me.golemcore.planner.domain.model.SessionView;
import me.golemcore.planner.domain.service.PlannerSessionService;
import me.golemcore.planner.domain.service.RecipeDatasetService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Planner session endpoints: render, chat, reset and resource deletion.
 *
 * <p>
 * Session operations block on remote calls, so each one runs on the bounded
 * elastic scheduler.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PlannerController {

    private final PlannerSessionService sessionService;
    private final RecipeDatasetService datasetService;

    @PostMapping("/sessions")
    public Mono<ResponseEntity<SessionDto>> createSession() {
        return blocking(() -> {
            SessionView view = sessionService.createSession();
            log.info("[API] Created session {}", view.getKey());
            return ResponseEntity.status(HttpStatus.CREATED).body(toDto(view));
        });
    }

    @GetMapping("/sessions/{key}")
    public Mono<ResponseEntity<SessionDto>> renderSession(@PathVariable String key) {
        return blocking(() -> ResponseEntity.ok(toDto(sessionService.render(key))));
    }

    @PostMapping("/sessions/{key}/messages")
    public Mono<ResponseEntity<TurnResponse>> sendMessage(@PathVariable String key,
            @RequestBody SendMessageRequest request) {
        return blocking(() -> {
            String text = request != null ? request.getText() : null;
            ConversationTurn turn = sessionService.sendMessage(key, text);
            return ResponseEntity.ok(TurnResponse.builder()
                    .outcome(turn.getOutcome().name())
                    .runId(turn.getRunId())
                    .responses(turn.getResponses())
                    .error(turn.getError())
                    .session(toDto(sessionService.describe(key)))
                    .build());
        });
    }

    @PostMapping("/sessions/{key}/reset")
    public Mono<ResponseEntity<SessionDto>> resetConversation(@PathVariable String key) {
        return blocking(() -> ResponseEntity.ok(toDto(sessionService.resetConversation(key))));
    }

    @DeleteMapping("/sessions/{key}/resources")
    public Mono<ResponseEntity<CleanupResponse>> deleteResources(@PathVariable String key) {
        return blocking(() -> {
            CleanupReport report = sessionService.deleteResources(key);
            return ResponseEntity.ok(CleanupResponse.builder()
                    .agentDeleted(report.isAgentDeleted())
                    .vectorIndexDeleted(report.isVectorIndexDeleted())
                    .fileDeleted(report.isFileDeleted())
                    .session(toDto(sessionService.describe(key)))
                    .build());
        });
    }

    @DeleteMapping("/sessions/{key}")
    public Mono<ResponseEntity<Void>> discardSession(@PathVariable String key) {
        return blocking(() -> {
            sessionService.discardSession(key);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @GetMapping("/recipes")
    public Mono<ResponseEntity<RecipesResponse>> getRecipes() {
        return blocking(() -> ResponseEntity.ok(RecipesResponse.builder()
                .recipes(datasetService.getRecipes())
                .dinnerHistory(datasetService.getDinnerHistory())
                .build()));
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private SessionDto toDto(SessionView view) {
        List<SessionDto.MessageDto> messages = view.getMessages().stream()
                .map(this::toMessageDto)
                .toList();
        return SessionDto.builder()
                .key(view.getKey())
                .status(view.getStatus().name())
                .error(view.getError())
                .agentId(view.getAgentId())
                .vectorIndexId(view.getVectorIndexId())
                .uploadedFileId(view.getUploadedFileId())
                .threadId(view.getThreadId())
                .runId(view.getRunId())
                .messages(messages)
                .lastActivity(view.getLastActivity() != null ? view.getLastActivity().toString() : null)
                .cleanedUp(view.isCleanedUp())
                .build();
    }

    private SessionDto.MessageDto toMessageDto(ChatEntry entry) {
        return SessionDto.MessageDto.builder()
                .role(entry.getRole().name().toLowerCase(Locale.ROOT))
                .text(entry.getText())
                .build();
    }
}
