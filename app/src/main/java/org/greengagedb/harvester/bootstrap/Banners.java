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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.greengagedb.harvester.plugin.PluginDescriptor;
import org.greengagedb.harvester.scheduler.CollectorInfo;

import java.util.List;

/**
 * Logs the startup banner together with a summary of what was loaded: one line per
 * plugin and the collectors registered with the scheduler.
 */
@Slf4j
@ApplicationScoped
public class Banners {

    private final int width;

    @Inject
    public Banners(@ConfigProperty(name = "app.banner.width", defaultValue = "60") int width) {
        this.width = width;
    }

    public void printHeader() {
        log.info(rule('='));
        log.info(centerText("Greengage Harvester Starting"));
        log.info(rule('='));
    }

    /**
     * Print the loaded plugins and registered collectors.
     *
     * @param plugins    Plugins loaded on startup, in load order
     * @param collectors Collectors registered with the scheduler
     */
    public void printInventory(List<PluginDescriptor> plugins, List<CollectorInfo> collectors) {
        log.info(rule('-'));
        if (plugins.isEmpty()) {
            log.warn("  No plugins loaded, collection passes will be empty");
        } else {
            log.info("  Plugins ({}):", plugins.size());
            plugins.forEach(plugin -> log.info("    - {}", plugin));
        }
        log.info("  Collectors ({}):", collectors.size());
        collectors.forEach(collector -> log.info("    {} {}", collector.handle(), collector.name()));
        log.info(rule('-'));
    }

    public void printFooter() {
        log.info(rule('='));
        log.info(centerText("Harvester Started Successfully"));
        log.info("  Metrics endpoint:     /metrics");
        log.info("  Live check:           /q/health/live");
        log.info(rule('='));
    }

    String rule(char c) {
        return String.valueOf(c).repeat(width);
    }

    String centerText(String text) {
        int padding = (width - text.length()) / 2;
        return padding <= 0 ? text : " ".repeat(padding) + text;
    }
}
