/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.greengagedb.harvester.scheduler;

import java.util.List;

/**
 * Raised when a scheduling pass cannot make progress: the remaining collectors depend on
 * groups that never finish, either because of a cycle or because the group has no
 * registered collectors.
 *
 * <p>Collectors that ran in earlier layers of the aborted pass keep their side effects.
 */
public class UnmetDependenciesException extends SchedulerException {

    private final List<CollectorHandle> pending;

    public UnmetDependenciesException(List<CollectorHandle> pending) {
        super("Unable to schedule %d collector(s) with unmet dependencies: %s"
                .formatted(pending.size(), pending));
        this.pending = List.copyOf(pending);
    }

    /**
     * @return Handles that were still pending when the pass stalled, in handle order
     */
    public List<CollectorHandle> getPending() {
        return pending;
    }
}
