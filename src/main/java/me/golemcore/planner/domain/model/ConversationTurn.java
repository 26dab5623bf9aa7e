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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one user turn. {@code responses} holds assistant texts in creation
 * order; on any outcome other than {@link Outcome#COMPLETED} it is empty and
 * {@code error} describes what the user was shown instead.
 */
@Data
@Builder
public class ConversationTurn {

    private Outcome outcome;
    private String threadId;
    private String runId;

    @Builder.Default
    private List<String> responses = new ArrayList<>();

    private String error;

    public enum Outcome {
        /** Run completed; responses were collected. */
        COMPLETED,
        /** The platform reported the run as failed (or cancelled/expired). */
        RUN_FAILED,
        /** A remote call raised before the run could finish. */
        SEND_FAILED,
        /** The run did not reach a terminal status before the deadline. */
        TIMED_OUT
    }
}
