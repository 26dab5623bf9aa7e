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

package me.golemcore.planner.port.outbound;

import java.util.List;
import java.util.Map;

/**
 * Port for row-oriented reads of the spreadsheet holding the recipe catalog and
 * the recency log.
 */
public interface SpreadsheetPort {

    /**
     * Read a worksheet as rows keyed by the header row.
     *
     * @param sourceIndex
     *            zero-based worksheet index
     * @param rowLimit
     *            when non-null, only the last {@code rowLimit} data rows are
     *            returned
     * @return data rows in sheet order, each an insertion-ordered map
     * @throws IndexOutOfBoundsException
     *             if {@code sourceIndex} exceeds the available worksheets
     */
    List<Map<String, String>> readRows(int sourceIndex, Integer rowLimit);
}
