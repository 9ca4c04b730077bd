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
package org.greengagedb.harvester.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;
import org.greengagedb.harvester.collector.CollectionOrchestrator;
import org.greengagedb.harvester.collector.CollectionResult;
import org.greengagedb.harvester.scheduler.CollectorScheduler;

import java.util.Optional;

/**
 * Health check for the collector scheduler.
 * Down only when the last collection pass failed.
 */
@Liveness
@ApplicationScoped
public class SchedulerHealthCheck implements HealthCheck {

    private final CollectorScheduler scheduler;
    private final CollectionOrchestrator orchestrator;

    @Inject
    public SchedulerHealthCheck(CollectorScheduler scheduler, CollectionOrchestrator orchestrator) {
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
    }

    @Override
    public HealthCheckResponse call() {
        Optional<CollectionResult> last = orchestrator.getLastResult();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("collector-scheduler")
                .status(last.map(CollectionResult::successful).orElse(true))
                .withData("collectors", scheduler.size())
                .withData("idle", scheduler.allIdle());
        last.ifPresent(result -> builder.withData("lastPassAgeSeconds", result.getAge().toSeconds()));
        return builder.build();
    }
}
