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

package me.golemcore.planner.adapter.outbound.sheets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.planner.domain.exception.ConfigurationException;
import me.golemcore.planner.domain.exception.SheetsException;
import me.golemcore.planner.infrastructure.config.PlannerProperties;
import me.golemcore.planner.port.outbound.SpreadsheetPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads worksheets through the Google Sheets v4 REST API.
 *
 * <p>
 * Worksheets are addressed by position: the adapter lists the spreadsheet's
 * sheets, picks the one at the requested index and fetches its values. The
 * first row is the header.
 */
@Component
@Slf4j
public class GoogleSheetsAdapter implements SpreadsheetPort {

    private final PlannerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GoogleSheetsAdapter(PlannerProperties properties, OkHttpClient okHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Map<String, String>> readRows(int sourceIndex, Integer rowLimit) {
        List<String> titles = listWorksheetTitles();
        if (sourceIndex < 0 || sourceIndex >= titles.size()) {
            throw new IndexOutOfBoundsException(
                    "worksheet index " + sourceIndex + " out of range (0.." + (titles.size() - 1) + ")");
        }
        String title = titles.get(sourceIndex);

        JsonNode values = get(spreadsheetUrl().addPathSegment("values").addPathSegment(title).build())
                .path("values");
        List<Map<String, String>> rows = toRows(values, rowLimit);
        log.debug("[Sheets] Read {} rows from worksheet '{}'", rows.size(), title);
        return rows;
    }

    private List<String> listWorksheetTitles() {
        HttpUrl url = spreadsheetUrl().addQueryParameter("fields", "sheets.properties").build();
        List<String> titles = new ArrayList<>();
        for (JsonNode sheet : get(url).path("sheets")) {
            titles.add(sheet.path("properties").path("title").asText());
        }
        return titles;
    }

    static List<Map<String, String>> toRows(JsonNode values, Integer rowLimit) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (!values.isArray() || values.size() <= 1) {
            return rows;
        }

        List<String> header = new ArrayList<>();
        values.get(0).forEach(cell -> header.add(cell.asText()));

        int first = 1;
        if (rowLimit != null && rowLimit >= 0) {
            first = Math.max(1, values.size() - rowLimit);
        }
        for (int i = first; i < values.size(); i++) {
            JsonNode cells = values.get(i);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                JsonNode cell = cells.get(c);
                row.put(header.get(c), cell != null ? cell.asText() : "");
            }
            rows.add(row);
        }
        return rows;
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private JsonNode get(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url).get();
        String accessToken = properties.getSheets().getAccessToken();
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Sheets] GET {} returned HTTP {}", url.encodedPath(), response.code());
                throw new SheetsException("Spreadsheet read failed (HTTP " + response.code() + ")");
            }
            return objectMapper.readTree(content);
        } catch (IOException e) {
            log.warn("[Sheets] GET {} failed: {}", url.encodedPath(), e.getMessage());
            throw new SheetsException("Spreadsheet read failed: " + e.getMessage(), e);
        }
    }

    private HttpUrl.Builder spreadsheetUrl() {
        PlannerProperties.SheetsProperties sheets = properties.getSheets();
        if (sheets.getSpreadsheetId() == null || sheets.getSpreadsheetId().isBlank()) {
            throw new ConfigurationException("planner.sheets.spreadsheet-id is not configured");
        }
        HttpUrl base = HttpUrl.parse(sheets.getBaseUrl());
        if (base == null) {
            throw new ConfigurationException("planner.sheets.base-url is not a valid URL: " + sheets.getBaseUrl());
        }
        HttpUrl.Builder builder = base.newBuilder()
                .addPathSegment("spreadsheets").addPathSegment(sheets.getSpreadsheetId());

        String apiKey = sheets.getApiKey();
        boolean hasToken = sheets.getAccessToken() != null && !sheets.getAccessToken().isBlank();
        if (!hasToken && apiKey != null && !apiKey.isBlank()) {
            builder.addQueryParameter("key", apiKey);
        }
        return builder;
    }
}
