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
package org.greengagedb.harvester.collector;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.harvester.metrics.HarvesterMetrics;
import org.greengagedb.harvester.scheduler.CollectorInfo;
import org.greengagedb.harvester.scheduler.CollectorScheduler;
import org.greengagedb.harvester.scheduler.UnmetDependenciesException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives collection passes through the {@link CollectorScheduler}, one at a time.
 *
 * <p>A pass requested while another is running is skipped and the last result stays
 * available through {@link #getLastResult()}.
 */
@Slf4j
@ApplicationScoped
public class CollectionOrchestrator {

    private final Lock passLock = new ReentrantLock();
    private final AtomicReference<CollectionResult> lastResult = new AtomicReference<>();

    private final CollectorScheduler scheduler;
    private final HarvesterMetrics metrics;

    @Inject
    public CollectionOrchestrator(CollectorScheduler scheduler, HarvesterMetrics metrics) {
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    /**
     * Run one collection pass unless a pass is already in progress.
     *
     * @return Result of this pass, or the last completed result if the pass was skipped
     */
    public Optional<CollectionResult> collect() {
        if (!passLock.tryLock()) {
            CollectionResult cached = lastResult.get();
            if (cached != null) {
                log.debug("Collection already in progress, last pass finished {} ago", cached.getAge());
            } else {
                log.warn("Collection already in progress and no previous result available");
            }
            return Optional.ofNullable(cached);
        }

        try {
            CollectionResult result = performPassInternal();
            lastResult.set(result);
            return Optional.of(result);
        } finally {
            passLock.unlock();
        }
    }

    private CollectionResult performPassInternal() {
        Instant start = Instant.now();
        metrics.incrementTotalPasses();
        log.debug("Starting collection pass over {} collectors", scheduler.size());

        try {
            scheduler.schedule();
            return CollectionResult.successful(start);
        } catch (UnmetDependenciesException e) {
            log.error("Collection pass aborted: {}", e.getMessage());
            metrics.incrementTotalError();
            return CollectionResult.failed(start, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error during collection pass: {}", e.getMessage(), e);
            metrics.incrementTotalError();
            return CollectionResult.failed(start, e);
        } finally {
            recordDuration(start);
        }
    }

    private void recordDuration(Instant start) {
        Duration duration = Duration.between(start, Instant.now());
        metrics.recordPassDuration(duration);
        log.debug("Collection pass completed in {} ms", duration.toMillis());
    }

    /**
     * @return Result of the last completed pass, or empty if none has completed
     */
    public Optional<CollectionResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    /**
     * @return Number of registered collectors
     */
    public int getActiveCollectorCount() {
        return scheduler.size();
    }

    /**
     * @return Snapshot of the registered collectors
     */
    public List<CollectorInfo> getCollectors() {
        return scheduler.collectors();
    }
}
