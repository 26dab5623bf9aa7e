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

import me.golemcore.planner.domain.model.DatasetRecord;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts spreadsheet rows into {@link DatasetRecord}s with a uniform shape so
 * rows from different worksheets can be indexed together.
 */
@Component
@RequiredArgsConstructor
public class DatasetNormalizer {

    static final String ID_COLUMN = "id";
    static final String SOURCE_KEY = "_source";

    private final PlannerProperties properties;

    public List<DatasetRecord> normalize(List<Map<String, String>> rows, String origin) {
        List<String> textColumns = selectTextColumns(rows);
        List<DatasetRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);

            String id = row.containsKey(ID_COLUMN) ? row.get(ID_COLUMN) : String.valueOf(i);

            List<String> parts = new ArrayList<>(textColumns.size());
            for (String column : textColumns) {
                String value = row.get(column);
                parts.add(value != null ? value : "");
            }

            Map<String, String> metadata = new LinkedHashMap<>(row);
            metadata.put(SOURCE_KEY, origin);

            records.add(DatasetRecord.builder()
                    .id(id)
                    .text(String.join(" ", parts))
                    .origin(origin)
                    .metadata(metadata)
                    .build());
        }
        return records;
    }

    // Candidate columns present anywhere in the table, in configured order;
    // every column when none of them is present.
    private List<String> selectTextColumns(List<Map<String, String>> rows) {
        Set<String> present = new LinkedHashSet<>();
        rows.forEach(row -> present.addAll(row.keySet()));

        List<String> selected = properties.getSheets().getTextColumns().stream()
                .filter(present::contains)
                .toList();
        return selected.isEmpty() ? new ArrayList<>(present) : selected;
    }
}
