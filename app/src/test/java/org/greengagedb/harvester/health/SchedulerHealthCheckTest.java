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

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.greengagedb.harvester.collector.CollectionOrchestrator;
import org.greengagedb.harvester.collector.CollectionResult;
import org.greengagedb.harvester.scheduler.CollectorScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchedulerHealthCheckTest {

    @Mock
    private CollectorScheduler scheduler;

    @Mock
    private CollectionOrchestrator orchestrator;

    private SchedulerHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        when(scheduler.size()).thenReturn(3);
        when(scheduler.allIdle()).thenReturn(true);
        healthCheck = new SchedulerHealthCheck(scheduler, orchestrator);
    }

    @Test
    void testUpBeforeFirstPass() {
        when(orchestrator.getLastResult()).thenReturn(Optional.empty());

        HealthCheckResponse response = healthCheck.call();

        assertEquals("collector-scheduler", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals(3L, response.getData().orElseThrow().get("collectors"));
        assertEquals(Boolean.TRUE, response.getData().orElseThrow().get("idle"));
    }

    @Test
    void testUpAfterSuccessfulPass() {
        when(orchestrator.getLastResult()).thenReturn(Optional.of(CollectionResult.successful(Instant.now())));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertTrue(response.getData().orElseThrow().containsKey("lastPassAgeSeconds"));
    }

    @Test
    void testDownAfterFailedPass() {
        when(orchestrator.getLastResult()).thenReturn(Optional.of(
                CollectionResult.failed(Instant.now(), new IllegalStateException("cycle"))));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
    }
}
