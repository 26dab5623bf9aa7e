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

package me.golemcore.planner.adapter.inbound.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.planner.domain.component.ToolComponent;
import me.golemcore.planner.domain.model.ToolDefinition;
import me.golemcore.planner.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Tool host endpoint called by the remote agent platform.
 *
 * <p>
 * {@code POST /mcp} accepts {@code tools/list} and {@code tools/call}
 * messages. Tool results are returned as a single text content item holding
 * the rows as a JSON array. {@code GET /health} is a static liveness probe.
 */
@RestController
@ConditionalOnProperty(prefix = "planner.tools", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RetrievalToolController {

    static final String SERVER_NAME = "google-sheets-recipes";

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;

    public RetrievalToolController(List<ToolComponent> toolComponents, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        for (ToolComponent tool : toolComponents) {
            if (tool.isEnabled()) {
                tools.put(tool.getToolName(), tool);
            }
        }
        log.info("[Tools] Serving {} tools: {}", tools.size(), tools.keySet());
    }

    @PostMapping("/mcp")
    public Mono<ResponseEntity<Map<String, Object>>> handle(@RequestBody Map<String, Object> body) {
        return Mono.fromCallable(() -> dispatch(body))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    Throwable cause = unwrap(e);
                    log.warn("[Tools] Request failed: {}: {}", cause.getClass().getSimpleName(), cause.getMessage());
                    Map<String, Object> error = new LinkedHashMap<>();
                    error.put("error", String.valueOf(cause.getMessage()));
                    error.put("type", cause.getClass().getSimpleName());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error));
                });
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of("status", "healthy", "server", SERVER_NAME)));
    }

    private ResponseEntity<Map<String, Object>> dispatch(Map<String, Object> body) throws Exception {
        Object method = body != null ? body.get("method") : null;
        if ("tools/list".equals(method)) {
            return ResponseEntity.ok(Map.of("tools", tools.values().stream()
                    .map(ToolComponent::getDefinition)
                    .map(this::describe)
                    .toList()));
        }
        if ("tools/call".equals(method)) {
            return ResponseEntity.ok(call(asMap(body.get("params"))));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "Unknown method: " + method));
    }

    private Map<String, Object> call(Map<String, Object> params) throws Exception {
        Object name = params.get("name");
        ToolComponent tool = tools.get(String.valueOf(name));
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool: " + name);
        }
        log.debug("[Tools] Calling {}", name);
        ToolResult result = tool.execute(asMap(params.get("arguments"))).join();
        log.info("[Tools] {} returned {}", name, result.getSummary());

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", "text");
        content.put("text", objectMapper.writeValueAsString(result.getRows()));
        return Map.of("content", List.of(content));
    }

    private Map<String, Object> describe(ToolDefinition definition) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", definition.getName());
        entry.put("description", definition.getDescription());
        entry.put("inputSchema", definition.getInputSchema());
        return entry;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
