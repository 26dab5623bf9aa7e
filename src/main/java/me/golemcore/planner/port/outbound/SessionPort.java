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

import me.golemcore.planner.domain.model.SessionState;

import java.util.List;
import java.util.Optional;

/**
 * Port for the session-keyed state store. One {@link SessionState} per key; no
 * state is shared between keys.
 */
public interface SessionPort {

    SessionState getOrCreate(String sessionKey);

    Optional<SessionState> get(String sessionKey);

    /**
     * Create a state under a freshly generated key.
     */
    SessionState create();

    void remove(String sessionKey);

    /**
     * Remove {@code expected} only if it is still the state stored under
     * {@code sessionKey}.
     *
     * @return true if the state was removed
     */
    boolean remove(String sessionKey, SessionState expected);

    List<SessionState> listAll();
}
