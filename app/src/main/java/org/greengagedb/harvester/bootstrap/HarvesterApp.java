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
package org.greengagedb.harvester.bootstrap;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.harvester.collector.CollectionOrchestrator;
import org.greengagedb.harvester.config.CollectionConfig;
import org.greengagedb.harvester.config.SchedulerConfig;
import org.greengagedb.harvester.plugin.Plugin;
import org.greengagedb.harvester.plugin.PluginDescriptor;
import org.greengagedb.harvester.plugin.PluginManager;

import java.util.List;

/**
 * Application lifecycle bean that loads plugins on startup and schedules periodic
 * collection passes.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: print banner, load every discovered {@link Plugin}, optionally run a first pass</li>
 *   <li>Runtime: periodic passes via the Quarkus scheduler</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class HarvesterApp {
    private final PluginManager pluginManager;
    private final CollectionOrchestrator orchestrator;
    private final CollectionConfig collectionConfig;
    private final SchedulerConfig schedulerConfig;
    private final Instance<Plugin> plugins;
    private final Banners banner;

    @Inject
    public HarvesterApp(PluginManager pluginManager,
                        CollectionOrchestrator orchestrator,
                        CollectionConfig collectionConfig,
                        SchedulerConfig schedulerConfig,
                        Instance<Plugin> plugins,
                        Banners banner) {
        this.pluginManager = pluginManager;
        this.orchestrator = orchestrator;
        this.collectionConfig = collectionConfig;
        this.schedulerConfig = schedulerConfig;
        this.plugins = plugins;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();

        List<PluginDescriptor> loaded = pluginManager.loadAll(plugins);
        banner.printInventory(loaded, orchestrator.getCollectors());

        logConfiguration();

        if (collectionConfig.runOnStartup()) {
            orchestrator.collect().ifPresent(result -> {
                if (!result.successful()) {
                    log.warn("Initial collection pass failed, will retry on next interval");
                }
            });
        }

        banner.printFooter();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Collection interval:    {}", collectionConfig.interval());
        log.info("  Active collectors:      {}", orchestrator.getActiveCollectorCount());
        log.info("  Worker thread prefix:   {}", schedulerConfig.threadNamePrefix());
        log.info("  Daemon worker threads:  {}", schedulerConfig.daemonThreads());
    }

    /**
     * Periodic collection job. Overlapping executions are skipped.
     */
    @Scheduled(every = "${app.collection.interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void schedulePeriodicCollection() {
        log.debug("Periodic collection triggered");
        try {
            orchestrator.collect().ifPresent(result -> {
                if (result.isStale(collectionConfig.resultMaxAge())) {
                    log.warn("Last collection result is {} old", result.getAge());
                }
            });
        } catch (Exception e) {
            // keep the Quarkus scheduler running
            log.error("Unexpected error in scheduled collection: {}", e.getMessage(), e);
        }
    }
}
