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

import me.golemcore.planner.domain.exception.ConfigurationException;
import me.golemcore.planner.domain.model.DatasetRecord;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.SpreadsheetPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Source of the recipe catalog, the recent dinner history and the combined
 * dataset indexed for each session. Results are cached for
 * {@code planner.sheets.cache-ttl-seconds}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeDatasetService {

    private static final String KEY_RECIPES = "recipes";
    private static final String KEY_HISTORY = "history";

    private final SpreadsheetPort spreadsheetPort;
    private final DatasetNormalizer normalizer;
    private final PlannerProperties properties;
    private final Clock clock;

    private final Map<String, CachedTable> cache = new ConcurrentHashMap<>();

    public List<Map<String, String>> getRecipes() {
        PlannerProperties.SheetsProperties sheets = requireConfigured();
        return cached(KEY_RECIPES, () -> spreadsheetPort.readRows(sheets.getRecipesWorksheetIndex(), null));
    }

    public List<Map<String, String>> getDinnerHistory() {
        PlannerProperties.SheetsProperties sheets = requireConfigured();
        return cached(KEY_HISTORY, () -> spreadsheetPort.readRows(sheets.getHistoryWorksheetIndex(),
                sheets.getHistoryRowLimit()));
    }

    /**
     * Recipe records followed by dinner history records.
     */
    public List<DatasetRecord> getCombinedDataset() {
        List<DatasetRecord> combined = new ArrayList<>();
        combined.addAll(normalizer.normalize(getRecipes(), DatasetRecord.ORIGIN_RECIPES));
        combined.addAll(normalizer.normalize(getDinnerHistory(), DatasetRecord.ORIGIN_DINNER_HISTORY));
        log.debug("[Sheets] Combined dataset has {} records", combined.size());
        return combined;
    }

    private List<Map<String, String>> cached(String key, Supplier<List<Map<String, String>>> loader) {
        Instant now = clock.instant();
        Duration ttl = Duration.ofSeconds(properties.getSheets().getCacheTtlSeconds());
        CachedTable entry = cache.get(key);
        if (entry != null && now.isBefore(entry.loadedAt().plus(ttl))) {
            return entry.rows();
        }
        List<Map<String, String>> rows = List.copyOf(loader.get());
        cache.put(key, new CachedTable(rows, now));
        log.info("[Sheets] Loaded {} rows for {}", rows.size(), key);
        return rows;
    }

    private PlannerProperties.SheetsProperties requireConfigured() {
        PlannerProperties.SheetsProperties sheets = properties.getSheets();
        if (sheets.getSpreadsheetId() == null || sheets.getSpreadsheetId().isBlank()) {
            throw new ConfigurationException("planner.sheets.spreadsheet-id is not configured");
        }
        return sheets;
    }

    private record CachedTable(List<Map<String, String>> rows, Instant loadedAt) {
    }
}
