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

/**
 * Failure of a single call to the remote agent platform: a non-2xx response, an
 * unparseable body or an I/O error. {@code status} is 0 when no HTTP response
 * was received.
 */
public class AgentPlatformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final int status;

    public AgentPlatformException(String operation, int status, String message) {
        super(operation + " failed" + (status > 0 ? " (HTTP " + status + ")" : "") + ": " + message);
        this.operation = operation;
        this.status = status;
    }

    public AgentPlatformException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
        this.status = 0;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatus() {
        return status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
