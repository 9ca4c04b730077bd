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
package org.greengagedb.harvester.plugin;

import org.greengagedb.harvester.scheduler.DataCollector;

import java.util.Map;
import java.util.Set;

/**
 * A bundle of collectors loaded and unloaded together.
 *
 * <p>When loaded, every collector of the plugin is registered under one group, the plugin
 * instance id. Collectors of a plugin run only after at least one collector of every
 * dependency plugin has run in the same pass.
 *
 * <p>Implementations discovered as CDI beans are loaded on startup.
 */
public interface Plugin {

    PluginDescriptor descriptor();

    /**
     * @return Plugins that must be loaded before this one (default: none)
     */
    default Set<PluginDescriptor> dependencies() {
        return Set.of();
    }

    /**
     * Collectors of this plugin, keyed by collector name. Registration follows the map's
     * iteration order.
     *
     * @return Collectors to register
     */
    Map<String, DataCollector> collectors();

    /**
     * Disabled plugins are skipped by {@link PluginManager#loadAll(Iterable)}.
     *
     * @return {@code true} if enabled (default)
     */
    default boolean isEnabled() {
        return true;
    }
}
