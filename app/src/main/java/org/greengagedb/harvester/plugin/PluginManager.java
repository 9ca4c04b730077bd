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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.harvester.scheduler.CollectorScheduler;
import org.greengagedb.harvester.scheduler.DataCollector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Loads plugins into the {@link CollectorScheduler} and unloads them again.
 *
 * <p>Loading a plugin assigns it a fresh instance id and registers its collectors under
 * that id as their group, with the instance ids of its dependency plugins as their
 * dependencies. Unloading removes the whole group.
 */
@Slf4j
@ApplicationScoped
public class PluginManager {

    private record LoadedPlugin(Plugin plugin, UUID instanceId) {
    }

    private final CollectorScheduler scheduler;
    private final Map<PluginDescriptor, LoadedPlugin> loaded = new LinkedHashMap<>();

    @Inject
    public PluginManager(CollectorScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Load a plugin and register its collectors.
     *
     * @param plugin Plugin to load
     * @return Instance id assigned to the plugin
     * @throws PluginException If the plugin is already loaded, a dependency is not loaded or a
     *                         collector cannot be registered (registered collectors are rolled back)
     */
    public synchronized UUID load(Plugin plugin) throws PluginException {
        PluginDescriptor descriptor = plugin.descriptor();
        if (loaded.containsKey(descriptor)) {
            throw new PluginException("Plugin " + descriptor + " is already loaded");
        }

        Set<UUID> dependencyIds = new HashSet<>();
        for (PluginDescriptor dependency : plugin.dependencies()) {
            LoadedPlugin dependencyPlugin = loaded.get(dependency);
            if (dependencyPlugin == null) {
                throw new PluginException("Plugin " + descriptor + " depends on " + dependency
                        + " which is not loaded");
            }
            dependencyIds.add(dependencyPlugin.instanceId());
        }

        Map<String, DataCollector> collectors = plugin.collectors();
        for (Map.Entry<String, DataCollector> entry : collectors.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                throw new PluginException("Plugin " + descriptor + " declares an invalid collector '"
                        + entry.getKey() + "'");
            }
        }

        UUID instanceId = UUID.randomUUID();
        try {
            for (Map.Entry<String, DataCollector> entry : collectors.entrySet()) {
                scheduler.add(instanceId, entry.getKey(), dependencyIds, entry.getValue());
            }
        } catch (RuntimeException e) {
            int removed = scheduler.removeAll(instanceId);
            log.error("Failed to register collectors of plugin {}, rolled back {} collector(s)", descriptor, removed);
            throw new PluginException("Plugin " + descriptor + " could not be registered: " + e.getMessage(), e);
        }
        loaded.put(descriptor, new LoadedPlugin(plugin, instanceId));
        log.info("Loaded plugin {} ({} collectors, instance {})",
                descriptor, collectors.size(), instanceId);
        return instanceId;
    }

    /**
     * Load every enabled plugin, dependencies first.
     *
     * <p>Plugins whose dependencies cannot be loaded are logged and skipped.
     *
     * @param plugins Plugins to load, in any order
     * @return Descriptors of the plugins loaded by this call, in load order
     */
    public synchronized List<PluginDescriptor> loadAll(Iterable<? extends Plugin> plugins) {
        List<Plugin> remaining = new ArrayList<>();
        for (Plugin plugin : plugins) {
            if (plugin.isEnabled()) {
                remaining.add(plugin);
            } else {
                log.debug("Disabled plugin: {}", plugin.descriptor());
            }
        }

        List<PluginDescriptor> loadedNow = new ArrayList<>();
        boolean progress = true;
        while (!remaining.isEmpty() && progress) {
            progress = false;
            for (Plugin plugin : List.copyOf(remaining)) {
                if (!loaded.keySet().containsAll(plugin.dependencies())) {
                    continue;
                }
                remaining.remove(plugin);
                try {
                    load(plugin);
                    loadedNow.add(plugin.descriptor());
                    progress = true;
                } catch (PluginException e) {
                    log.error("Failed to load plugin {}: {}", plugin.descriptor(), e.getMessage());
                }
            }
        }

        for (Plugin plugin : remaining) {
            Set<PluginDescriptor> missing = new HashSet<>(plugin.dependencies());
            missing.removeAll(loaded.keySet());
            log.error("Skipping plugin {}: unmet dependencies {}", plugin.descriptor(), missing);
        }
        return loadedNow;
    }

    /**
     * Unload a plugin and remove its collectors.
     *
     * @param descriptor Plugin to unload
     * @throws PluginException If the plugin is not loaded or a loaded plugin depends on it
     */
    public synchronized void unload(PluginDescriptor descriptor) throws PluginException {
        LoadedPlugin plugin = loaded.get(descriptor);
        if (plugin == null) {
            throw new PluginException("Plugin " + descriptor + " is not loaded");
        }
        for (LoadedPlugin other : loaded.values()) {
            if (other.plugin().dependencies().contains(descriptor)) {
                throw new PluginException("Plugin " + descriptor + " is required by "
                        + other.plugin().descriptor());
            }
        }

        int removed = scheduler.removeAll(plugin.instanceId());
        loaded.remove(descriptor);
        log.info("Unloaded plugin {} ({} collectors removed)", descriptor, removed);
    }

    /**
     * @return Descriptors of loaded plugins, in load order
     */
    public synchronized List<PluginDescriptor> plugins() {
        return List.copyOf(loaded.keySet());
    }

    public synchronized boolean isLoaded(PluginDescriptor descriptor) {
        return loaded.containsKey(descriptor);
    }

    /**
     * @param descriptor Plugin to look up
     * @return Instance id (collector group) of the loaded plugin, or empty if not loaded
     */
    public synchronized Optional<UUID> instanceId(PluginDescriptor descriptor) {
        return Optional.ofNullable(loaded.get(descriptor)).map(LoadedPlugin::instanceId);
    }
}
