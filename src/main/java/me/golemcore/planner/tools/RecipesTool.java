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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns the whole recipe catalog.
 */
@Component
@RequiredArgsConstructor
public class RecipesTool implements ToolComponent {

    public static final String NAME = "get_recipes";

    private final RecipeDatasetService datasetService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withoutArguments(NAME, "Get all recipes from the recipe catalog");
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            List<Map<String, String>> recipes = datasetService.getRecipes();
            return ToolResult.of(recipes.size() + " recipes", recipes);
        });
    }
}
