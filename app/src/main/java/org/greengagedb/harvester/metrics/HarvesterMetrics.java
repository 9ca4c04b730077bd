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
package org.greengagedb.harvester.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.harvester.common.Constants;

import java.time.Duration;
import java.time.Instant;

/**
 * Internal harvester metrics
 */
@Slf4j
@ApplicationScoped
public class HarvesterMetrics {

    static final String NAME_TOTAL_PASSES = metricName(Constants.SUBSYSTEM_COLLECTION, "total_passes");
    static final String NAME_TOTAL_ERROR = metricName(Constants.SUBSYSTEM_COLLECTION, "total_error");
    static final String NAME_PASS_DURATION = metricName(Constants.SUBSYSTEM_COLLECTION, "duration_seconds");
    static final String NAME_COLLECTOR_ERROR = metricName(Constants.SUBSYSTEM_SCHEDULER, "collector_error");
    static final String NAME_UNMET_DEPENDENCIES = metricName(Constants.SUBSYSTEM_SCHEDULER, "unmet_dependencies");
    static final String NAME_UPTIME = Constants.NAMESPACE + "_uptime_seconds";

    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    private Counter passCounter;
    private Counter errorCounter;
    private Counter unmetDependenciesCounter;
    private Timer passDurationTimer;

    @Inject
    public HarvesterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        passCounter = Counter.builder(NAME_TOTAL_PASSES)
                .description("Total number of collection passes")
                .register(registry);
        errorCounter = Counter.builder(NAME_TOTAL_ERROR)
                .description("Total number of failed collection passes")
                .register(registry);
        unmetDependenciesCounter = Counter.builder(NAME_UNMET_DEPENDENCIES)
                .description("Number of scheduling passes aborted by unmet collector dependencies")
                .register(registry);
        passDurationTimer = Timer.builder(NAME_PASS_DURATION)
                .description("Duration of collection passes in seconds")
                .register(registry);
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the harvester started")
                .register(registry);
        log.info("Harvester metrics initialized");
    }

    public void incrementTotalPasses() {
        passCounter.increment();
    }

    public void incrementTotalError() {
        errorCounter.increment();
    }

    public void incrementUnmetDependencies() {
        unmetDependenciesCounter.increment();
    }

    /**
     * Increment error counter for a specific collector.
     * This helps identify which collector is causing issues.
     *
     * @param collectorName Name of the collector that failed
     */
    public void incrementCollectorError(String collectorName) {
        Counter.builder(NAME_COLLECTOR_ERROR)
                .tag(Constants.TAG_COLLECTOR, collectorName)
                .description("Number of failed runs per collector")
                .register(registry)
                .increment();
    }

    public void recordPassDuration(Duration duration) {
        passDurationTimer.record(duration);
    }

    // harvester_<subsystem>_<name>
    private static String metricName(String subsystem, String name) {
        return Constants.NAMESPACE + "_" + subsystem + "_" + name;
    }
}
