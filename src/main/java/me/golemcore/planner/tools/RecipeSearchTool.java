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

package me.golemcore.planner.tools;

import me.golemcore.planner.domain.component.ToolComponent;
import me.golemcore.planner.domain.model.ToolDefinition;
import me.golemcore.planner.domain.model.ToolResult;
import me.golemcore.planner.domain.service.RecipeDatasetService;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Filters the recipe catalog by season and/or preference.
 *
 * <p>
 * Both filters are optional. A filter matches when its trimmed value occurs,
 * ignoring case, inside the row's column value, so {@code "summer"} matches a
 * cell holding {@code "Spring, Summer"}. Rows without the column never match an
 * active filter.
 */
@Component
@RequiredArgsConstructor
public class RecipeSearchTool implements ToolComponent {

    public static final String NAME = "search_recipes";

    private static final String PARAM_SEASON = "season";
    private static final String PARAM_PREFERENCE = "preference";

    private final RecipeDatasetService datasetService;
    private final PlannerProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search recipes by season and/or dietary preference")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_SEASON, Map.of(
                                        "type", "string",
                                        "description", "Season to match, e.g. 'summer'"),
                                PARAM_PREFERENCE, Map.of(
                                        "type", "string",
                                        "description", "Preference to match, e.g. 'vegetarian'")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        String season = normalize(arguments.get(PARAM_SEASON));
        String preference = normalize(arguments.get(PARAM_PREFERENCE));
        PlannerProperties.SheetsProperties sheets = properties.getSheets();

        return CompletableFuture.supplyAsync(() -> {
            List<Map<String, String>> matches = datasetService.getRecipes().stream()
                    .filter(row -> matches(row, sheets.getSeasonColumn(), season))
                    .filter(row -> matches(row, sheets.getPreferenceColumn(), preference))
                    .toList();
            return ToolResult.of(matches.size() + " matching recipes", matches);
        });
    }

    private static boolean matches(Map<String, String> row, String column, String needle) {
        if (needle == null) {
            return true;
        }
        String value = row.get(column);
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text.toLowerCase(Locale.ROOT);
    }
}
