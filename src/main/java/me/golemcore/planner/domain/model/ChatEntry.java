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
 * One line of the session's display log. The log is append-only and its
 * insertion order is the display order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatEntry {

    private Role role;
    private String text;

    public static ChatEntry user(String text) {
        return new ChatEntry(Role.USER, text);
    }

    public static ChatEntry assistant(String text) {
        return new ChatEntry(Role.ASSISTANT, text);
    }

    public boolean isUser() {
        return role == Role.USER;
    }

    public enum Role {
        USER, ASSISTANT
    }
}
