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

/**
 * Identifiers of the three remote resources backing one session. Any field may
 * be null when the resource was never created or has already been deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvisionedResources {

    private String agentId;
    private String vectorIndexId;
    private String fileId;

    public boolean isEmpty() {
        return agentId == null && vectorIndexId == null && fileId == null;
    }
}
