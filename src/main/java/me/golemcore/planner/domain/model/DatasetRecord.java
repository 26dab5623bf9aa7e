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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform record indexed by the remote vector index, regardless of which
 * worksheet the row came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetRecord {

    public static final String ORIGIN_RECIPES = "recipes";
    public static final String ORIGIN_DINNER_HISTORY = "dinner_history";

    private String id;
    private String text;
    private String origin;

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();
}
