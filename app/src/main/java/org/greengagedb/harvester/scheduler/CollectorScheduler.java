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

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.harvester.config.SchedulerConfig;
import org.greengagedb.harvester.metrics.HarvesterMetrics;
import org.greengagedb.harvester.model.DataModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs registered collectors in dependency order against the shared {@link DataModel}.
 *
 * <p>Each collector belongs to a group (a plugin instance) and declares the groups it
 * depends on. {@link #schedule()} executes collectors in layers: a layer holds every
 * pending collector whose dependency groups have all finished in the current pass, and
 * all collectors of a layer run concurrently, each on its own worker thread.
 *
 * <p>A dependency on a group is satisfied as soon as <em>any</em> collector of that group
 * has completed a run in the current pass.
 *
 * <p><b>Thread Safety:</b> the registry is guarded by a read/write lock, so registration,
 * removal and introspection may race with each other. {@link #schedule()} is meant to be
 * driven by one caller at a time.
 */
@Slf4j
@ApplicationScoped
public class CollectorScheduler implements AutoCloseable {

    private final AtomicLong nextHandle = new AtomicLong(1);
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final Map<CollectorHandle, CollectorWorker> registry = new TreeMap<>();

    private final DataModel model;
    private final SchedulerConfig config;
    private final HarvesterMetrics metrics;

    @Inject
    public CollectorScheduler(DataModel model, SchedulerConfig config, HarvesterMetrics metrics) {
        this.model = model;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Register a collector and start its worker.
     *
     * <p>No ordering is checked here: a collector may be registered before any collector
     * of the groups it depends on.
     *
     * @param groupId      Group the collector belongs to
     * @param name         Human-readable collector name
     * @param dependencies Groups that must finish before the collector runs
     * @param collector    Collector to run
     * @return Handle of the new registration
     */
    public CollectorHandle add(UUID groupId, String name, Set<UUID> dependencies, DataCollector collector) {
        Objects.requireNonNull(groupId, "Group id must not be null");
        Objects.requireNonNull(name, "Name must not be null");
        Objects.requireNonNull(dependencies, "Dependencies must not be null");
        Objects.requireNonNull(collector, "Collector must not be null");

        CollectorHandle handle = new CollectorHandle(nextHandle.getAndIncrement());
        CollectorWorker worker = new CollectorWorker(
                handle,
                groupId,
                name,
                dependencies,
                collector,
                (collectorName, e) -> metrics.incrementCollectorError(collectorName),
                config.threadNamePrefix() + handle.value() + "-" + name,
                config.daemonThreads());
        worker.start();

        registryLock.writeLock().lock();
        try {
            registry.put(handle, worker);
        } finally {
            registryLock.writeLock().unlock();
        }
        log.info("Registered collector {} ({}) in group {} with {} dependencies",
                name, handle, groupId, dependencies.size());
        return handle;
    }

    /**
     * Remove a collector and terminate its worker, blocking until the worker thread exits.
     *
     * @param handle Handle to remove
     * @return {@code true} if the handle was registered
     */
    public boolean remove(CollectorHandle handle) {
        CollectorWorker worker;
        registryLock.writeLock().lock();
        try {
            worker = registry.remove(handle);
        } finally {
            registryLock.writeLock().unlock();
        }

        if (worker == null) {
            return false;
        }
        worker.terminate();
        log.info("Removed collector {} ({})", worker.getName(), handle);
        return true;
    }

    /**
     * Remove every collector of a group, blocking until all their worker threads exit.
     *
     * @param groupId Group to remove
     * @return Number of collectors removed
     */
    public int removeAll(UUID groupId) {
        List<CollectorWorker> removed = new ArrayList<>();
        registryLock.writeLock().lock();
        try {
            Iterator<CollectorWorker> it = registry.values().iterator();
            while (it.hasNext()) {
                CollectorWorker worker = it.next();
                if (worker.getGroupId().equals(groupId)) {
                    removed.add(worker);
                    it.remove();
                }
            }
        } finally {
            registryLock.writeLock().unlock();
        }

        for (CollectorWorker worker : removed) {
            worker.terminate();
        }
        if (!removed.isEmpty()) {
            log.info("Removed {} collector(s) of group {}", removed.size(), groupId);
        }
        return removed.size();
    }

    /**
     * @return Snapshot of all registered collectors in handle order
     */
    public List<CollectorInfo> collectors() {
        registryLock.readLock().lock();
        try {
            return registry.values().stream()
                    .map(worker -> new CollectorInfo(worker.getHandle(), worker.getName()))
                    .toList();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * @param groupId Group to filter by
     * @return Snapshot of the group's registered collectors in handle order
     */
    public List<CollectorInfo> collectors(UUID groupId) {
        registryLock.readLock().lock();
        try {
            return registry.values().stream()
                    .filter(worker -> worker.getGroupId().equals(groupId))
                    .map(worker -> new CollectorInfo(worker.getHandle(), worker.getName()))
                    .toList();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Point-in-time state of a collector, for diagnostics.
     *
     * @param handle Handle to look up
     * @return Current state, or empty if the handle is not registered
     */
    public Optional<CollectorState> state(CollectorHandle handle) {
        registryLock.readLock().lock();
        try {
            return Optional.ofNullable(registry.get(handle)).map(CollectorWorker::getState);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Whether no registered collector is running at the instant of the check.
     * Diagnostics only; the answer may be stale by the time it is returned.
     *
     * @return {@code true} if no collector is {@link CollectorState#RUNNING}
     */
    public boolean allIdle() {
        registryLock.readLock().lock();
        try {
            return registry.values().stream()
                    .noneMatch(worker -> worker.getState() == CollectorState.RUNNING);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * @return Number of registered collectors
     */
    public int size() {
        registryLock.readLock().lock();
        try {
            return registry.size();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Run every registered collector exactly once, in dependency order.
     *
     * <p>Each layer is dispatched in full before any of its collectors is waited on, so
     * the time spent per layer is bounded by its slowest collector. Collector failures do
     * not abort the pass. Nothing carries over between calls.
     *
     * @throws UnmetDependenciesException If the remaining collectors can never run
     */
    public void schedule() throws UnmetDependenciesException {
        Map<CollectorHandle, CollectorWorker> pending;
        registryLock.readLock().lock();
        try {
            pending = new TreeMap<>(registry);
        } finally {
            registryLock.readLock().unlock();
        }

        log.debug("Scheduling {} collector(s)", pending.size());
        Set<UUID> finishedGroups = new HashSet<>();
        int layer = 0;

        while (!pending.isEmpty()) {
            List<CollectorWorker> runnable = pending.values().stream()
                    .filter(worker -> finishedGroups.containsAll(worker.getDependencies()))
                    .toList();

            if (runnable.isEmpty()) {
                for (CollectorWorker worker : pending.values()) {
                    Set<UUID> missing = new HashSet<>(worker.getDependencies());
                    missing.removeAll(finishedGroups);
                    log.error("Collector {} ({}) in group {} has unmet dependencies: {}",
                            worker.getName(), worker.getHandle(), worker.getGroupId(), missing);
                }
                metrics.incrementUnmetDependencies();
                throw new UnmetDependenciesException(new ArrayList<>(pending.keySet()));
            }

            layer++;
            log.debug("Dispatching layer {} with {} collector(s)", layer, runnable.size());
            List<CollectorWorker> dispatched = new ArrayList<>(runnable.size());
            for (CollectorWorker worker : runnable) {
                if (worker.run(model)) {
                    dispatched.add(worker);
                } else {
                    log.warn("Collector {} ({}) was removed during scheduling", worker.getName(), worker.getHandle());
                    pending.remove(worker.getHandle());
                }
            }

            for (CollectorWorker worker : dispatched) {
                CollectorState observed = worker.awaitIdle();
                if (observed == CollectorState.IDLE) {
                    finishedGroups.add(worker.getGroupId());
                } else {
                    log.warn("Collector {} ({}) was removed during scheduling", worker.getName(), worker.getHandle());
                }
                pending.remove(worker.getHandle());
            }
        }
        log.debug("Scheduling completed in {} layer(s)", layer);
    }

    /**
     * Terminate every registered worker.
     */
    @PreDestroy
    @Override
    public void close() {
        List<CollectorWorker> workers;
        registryLock.writeLock().lock();
        try {
            workers = new ArrayList<>(registry.values());
            registry.clear();
        } finally {
            registryLock.writeLock().unlock();
        }

        for (CollectorWorker worker : workers) {
            worker.terminate();
        }
        if (!workers.isEmpty()) {
            log.info("Terminated {} collector worker(s)", workers.size());
        }
    }
}
