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

package me.golemcore.planner.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the planner, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code planner.*} prefix:
 * <ul>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link PlatformProperties} - remote agent platform and agent shape</li>
 * <li>{@link SheetsProperties} - spreadsheet source and dataset shaping</li>
 * <li>{@link SessionProperties} - inactivity cleanup and eviction</li>
 * <li>{@link ToolsProperties} - retrieval extension server</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "planner")
@Data
public class PlannerProperties {

    private HttpProperties http = new HttpProperties();
    private PlatformProperties platform = new PlatformProperties();
    private SheetsProperties sheets = new SheetsProperties();
    private SessionProperties session = new SessionProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== AGENT PLATFORM ====================

    @Data
    public static class PlatformProperties {
        private String endpoint = "";
        private String apiKey = "";
        private String apiVersion = "v1";
        private String model = "gpt-4o";
        private String agentName = "dinner-planning-agent";
        private String instructionsResource = "prompts/planner-instructions.md";
        private String description = "Weekly dinner planner integrated with the user's favourite recipes";
        private String connectedAgentId = "";
        private String retrievalServerUrl = "";
        private String retrievalServerLabel = "google_sheets";
        private long pollIntervalMs = 1000;
        private int runTimeoutSeconds = 300;
        private int vectorIndexTimeoutSeconds = 120;
    }

    // ==================== SPREADSHEET ====================

    @Data
    public static class SheetsProperties {
        private String spreadsheetId = "";
        private String baseUrl = "https://sheets.googleapis.com/v4";
        private String accessToken = "";
        private String apiKey = "";
        private int recipesWorksheetIndex = 0;
        private int historyWorksheetIndex = 2;
        private int historyRowLimit = 14;
        private int cacheTtlSeconds = 300;
        private List<String> textColumns = new ArrayList<>(List.of(
                "Rett", "Tidsforbruk min", "Lenke", "Sesong", "Preferanse", "uke", "dag",
                "Dish", "Season", "Preference"));
        private String seasonColumn = "Season";
        private String preferenceColumn = "Preference";
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionProperties {
        private int inactivityTimeoutMinutes = 10;
        private int sweepIntervalSeconds = 60;
        private int evictionMinutes = 120;
    }

    @Data
    public static class ToolsProperties {
        private boolean enabled = true;
    }
}
