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

package me.golemcore.planner.domain.component;

import me.golemcore.planner.domain.model.ToolDefinition;
import me.golemcore.planner.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieval tool exposed to the remote agent through the tool endpoint. Each
 * tool reads spreadsheet rows and returns them as structured data.
 */
public interface ToolComponent {

    /**
     * Name, description and JSON Schema of the tool's arguments, as listed to
     * the agent.
     */
    ToolDefinition getDefinition();

    /**
     * Run the tool. The returned future completes exceptionally when the
     * underlying read fails.
     *
     * @param arguments
     *            call arguments, never null
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> arguments);

    default String getToolName() {
        return getDefinition().getName();
    }

    default boolean isEnabled() {
        return true;
    }
}
