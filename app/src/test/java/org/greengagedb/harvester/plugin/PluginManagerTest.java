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

import org.greengagedb.harvester.scheduler.CollectorHandle;
import org.greengagedb.harvester.scheduler.CollectorScheduler;
import org.greengagedb.harvester.scheduler.DataCollector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PluginManagerTest {

    private static final PluginDescriptor CORE = new PluginDescriptor("core");
    private static final PluginDescriptor VERIFY = new PluginDescriptor("verify");
    private static final PluginDescriptor REPORT = new PluginDescriptor("report");

    @Mock
    private CollectorScheduler scheduler;

    private final DataCollector noop = model -> {
    };

    private Plugin plugin(PluginDescriptor descriptor, Set<PluginDescriptor> dependencies, String... collectorNames) {
        Map<String, DataCollector> collectors = new LinkedHashMap<>();
        for (String name : collectorNames) {
            collectors.put(name, noop);
        }
        return new Plugin() {
            @Override
            public PluginDescriptor descriptor() {
                return descriptor;
            }

            @Override
            public Set<PluginDescriptor> dependencies() {
                return dependencies;
            }

            @Override
            public Map<String, DataCollector> collectors() {
                return collectors;
            }
        };
    }

    @Test
    void testLoad_RegistersCollectorsUnderInstanceId() throws Exception {
        when(scheduler.add(any(), anyString(), anySet(), any())).thenReturn(new CollectorHandle(1));
        PluginManager manager = new PluginManager(scheduler);

        UUID instanceId = manager.load(plugin(CORE, Set.of(), "packages", "components"));

        verify(scheduler).add(instanceId, "packages", Set.of(), noop);
        verify(scheduler).add(instanceId, "components", Set.of(), noop);
        assertTrue(manager.isLoaded(CORE));
        assertEquals(Optional.of(instanceId), manager.instanceId(CORE));
    }

    @Test
    void testLoad_DependsOnInstanceIdsOfDependencies() throws Exception {
        when(scheduler.add(any(), anyString(), anySet(), any())).thenReturn(new CollectorHandle(1));
        PluginManager manager = new PluginManager(scheduler);

        UUID coreId = manager.load(plugin(CORE, Set.of(), "packages"));
        UUID verifyId = manager.load(plugin(VERIFY, Set.of(CORE), "routes"));

        verify(scheduler).add(verifyId, "routes", Set.of(coreId), noop);
        assertNotEquals(coreId, verifyId);
    }

    @Test
    void testLoad_FailsWhenDependencyNotLoaded() {
        PluginManager manager = new PluginManager(scheduler);

        PluginException e = assertThrows(PluginException.class,
                () -> manager.load(plugin(VERIFY, Set.of(CORE), "routes")));

        assertTrue(e.getMessage().contains("core"));
        verifyNoInteractions(scheduler);
        assertFalse(manager.isLoaded(VERIFY));
    }

    @Test
    void testLoad_FailsWhenAlreadyLoaded() throws Exception {
        PluginManager manager = new PluginManager(scheduler);
        manager.load(plugin(CORE, Set.of()));

        assertThrows(PluginException.class, () -> manager.load(plugin(CORE, Set.of())));
    }

    @Test
    void testLoad_RejectsNullCollectorBeforeRegistering() {
        PluginManager manager = new PluginManager(scheduler);
        Map<String, DataCollector> collectors = new LinkedHashMap<>();
        collectors.put("packages", noop);
        collectors.put("broken", null);
        Plugin plugin = mock(Plugin.class);
        when(plugin.descriptor()).thenReturn(CORE);
        when(plugin.dependencies()).thenReturn(Set.of());
        when(plugin.collectors()).thenReturn(collectors);

        PluginException e = assertThrows(PluginException.class, () -> manager.load(plugin));

        assertTrue(e.getMessage().contains("broken"));
        verifyNoInteractions(scheduler);
        assertFalse(manager.isLoaded(CORE));
    }

    @Test
    void testLoad_RollsBackRegisteredCollectorsWhenRegistrationFails() {
        when(scheduler.add(any(), eq("packages"), anySet(), any())).thenReturn(new CollectorHandle(1));
        when(scheduler.add(any(), eq("components"), anySet(), any()))
                .thenThrow(new IllegalStateException("registry closed"));
        when(scheduler.removeAll(any())).thenReturn(1);
        PluginManager manager = new PluginManager(scheduler);

        PluginException e = assertThrows(PluginException.class,
                () -> manager.load(plugin(CORE, Set.of(), "packages", "components")));

        ArgumentCaptor<UUID> instanceId = ArgumentCaptor.forClass(UUID.class);
        verify(scheduler).add(instanceId.capture(), eq("packages"), anySet(), any());
        verify(scheduler).removeAll(instanceId.getValue());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(manager.isLoaded(CORE));
        assertTrue(manager.plugins().isEmpty());
    }

    @Test
    void testLoadAll_LoadsInDependencyOrderAndSkipsUnsatisfiable() {
        when(scheduler.add(any(), anyString(), anySet(), any())).thenReturn(new CollectorHandle(1));
        PluginManager manager = new PluginManager(scheduler);
        Plugin orphan = plugin(new PluginDescriptor("orphan"), Set.of(new PluginDescriptor("missing")), "x");

        List<PluginDescriptor> loaded = manager.loadAll(List.of(
                plugin(REPORT, Set.of(VERIFY), "summary"),
                orphan,
                plugin(VERIFY, Set.of(CORE), "routes"),
                plugin(CORE, Set.of(), "packages")));

        assertEquals(List.of(CORE, VERIFY, REPORT), loaded);
        assertEquals(List.of(CORE, VERIFY, REPORT), manager.plugins());
        assertFalse(manager.isLoaded(orphan.descriptor()));
        verify(scheduler, never()).add(any(), eq("x"), anySet(), any());
    }

    @Test
    void testLoadAll_SkipsDisabledPlugins() {
        PluginManager manager = new PluginManager(scheduler);
        Plugin disabled = mock(Plugin.class);
        when(disabled.isEnabled()).thenReturn(false);
        when(disabled.descriptor()).thenReturn(CORE);

        List<PluginDescriptor> loaded = manager.loadAll(List.of(disabled));

        assertTrue(loaded.isEmpty());
        verify(disabled, never()).collectors();
    }

    @Test
    void testUnload_RemovesCollectorGroup() throws Exception {
        when(scheduler.removeAll(any())).thenReturn(2);
        PluginManager manager = new PluginManager(scheduler);
        UUID coreId = manager.load(plugin(CORE, Set.of()));

        manager.unload(CORE);

        verify(scheduler).removeAll(coreId);
        assertFalse(manager.isLoaded(CORE));
        assertEquals(Optional.empty(), manager.instanceId(CORE));
    }

    @Test
    void testUnload_FailsWhileRequiredByLoadedPlugin() throws Exception {
        PluginManager manager = new PluginManager(scheduler);
        manager.load(plugin(CORE, Set.of()));
        manager.load(plugin(VERIFY, Set.of(CORE)));

        assertThrows(PluginException.class, () -> manager.unload(CORE));
        verify(scheduler, never()).removeAll(any());

        manager.unload(VERIFY);
        manager.unload(CORE);
        assertTrue(manager.plugins().isEmpty());
    }

    @Test
    void testUnload_FailsWhenNotLoaded() {
        PluginManager manager = new PluginManager(scheduler);

        assertThrows(PluginException.class, () -> manager.unload(CORE));
    }

    @Test
    void testDescriptor_RejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new PluginDescriptor(" "));
        assertThrows(IllegalArgumentException.class, () -> new PluginDescriptor(null));
    }
}
