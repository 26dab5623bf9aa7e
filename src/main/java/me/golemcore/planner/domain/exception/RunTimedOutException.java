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

package me.golemcore.planner.domain.exception;

import java.time.Duration;

/**
 * A run did not reach a terminal status before the wait deadline. The run may
 * still complete on the platform; nothing cancels it.
 */
public class RunTimedOutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String runId;

    public RunTimedOutException(String runId, Duration waited) {
        super("Run " + runId + " did not finish within " + waited.toSeconds() + "s");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
