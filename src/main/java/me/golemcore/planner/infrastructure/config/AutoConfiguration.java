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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared beans (clock, JSON mapper) and a startup summary of the planner
 * configuration.
 *
 * <p>
 * Missing endpoint or spreadsheet settings only produce a warning here: the
 * service still starts and each affected request fails with a configuration
 * error.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final PlannerProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Dinner planner v{} starting...", version);

        PlannerProperties.PlatformProperties platform = properties.getPlatform();
        log.info("Agent model: {}, api-version: {}", platform.getModel(), platform.getApiVersion());
        log.info("Inactivity timeout: {} min, sweep every {}s",
                properties.getSession().getInactivityTimeoutMinutes(),
                properties.getSession().getSweepIntervalSeconds());

        if (isBlank(platform.getEndpoint())) {
            log.warn("planner.platform.endpoint is not set, sessions cannot be provisioned");
        }
        if (isBlank(properties.getSheets().getSpreadsheetId())) {
            log.warn("planner.sheets.spreadsheet-id is not set, the recipe dataset is unavailable");
        }
        if (isBlank(platform.getRetrievalServerUrl())) {
            log.info("No retrieval server configured, agents get file search only");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
