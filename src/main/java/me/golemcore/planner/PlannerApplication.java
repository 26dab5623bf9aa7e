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

package me.golemcore.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the dinner planner.
 *
 * <p>
 * The planner is a thin host around a remote conversational agent platform and
 * a spreadsheet of recipes. Its own responsibility is the lifecycle of the
 * remote resources each user session needs:
 * <ul>
 * <li><b>Provisioning</b> - uploaded dataset file, vector index over it and an
 * agent bound to that index</li>
 * <li><b>Conversation</b> - thread reuse, sequential runs, ordered assistant
 * responses and tool approvals</li>
 * <li><b>Cleanup</b> - best-effort deletion on request or after inactivity</li>
 * <li><b>Retrieval tools</b> - spreadsheet rows exposed over {@code /mcp} for
 * the agent</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → PlannerController, RetrievalToolController
 * Domain Layer       → PlannerSessionService and lifecycle services
 * Infrastructure     → Agent platform and Google Sheets adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code planner.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlannerApplication.class, args);
    }

}
