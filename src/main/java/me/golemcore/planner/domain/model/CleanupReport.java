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
 * Per-resource outcome of a cleanup pass. A flag is true only when a deletion
 * was attempted and succeeded; absent identifiers report false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupReport {

    private boolean agentDeleted;
    private boolean vectorIndexDeleted;
    private boolean fileDeleted;

    public static CleanupReport nothingDeleted() {
        return new CleanupReport(false, false, false);
    }

    public int successCount() {
        int count = 0;
        if (agentDeleted) {
            count++;
        }
        if (vectorIndexDeleted) {
            count++;
        }
        if (fileDeleted) {
            count++;
        }
        return count;
    }
}
