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

import me.golemcore.planner.domain.model.ProvisionedResources;

/**
 * Provisioning aborted at {@code step}. Resources created by earlier steps have
 * been rolled back; {@code orphaned} lists the ones whose deletion also failed
 * and which the caller must keep for a later cleanup attempt.
 */
public class ProvisioningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String step;
    private final transient ProvisionedResources orphaned;

    public ProvisioningException(String step, ProvisionedResources orphaned, Throwable cause) {
        super("Provisioning failed at step '" + step + "': " + cause.getMessage(), cause);
        this.step = step;
        this.orphaned = orphaned != null ? orphaned : new ProvisionedResources();
    }

    public String getStep() {
        return step;
    }

    public ProvisionedResources getOrphaned() {
        return orphaned;
    }
}
