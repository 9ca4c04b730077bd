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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.harvester.model.DataModel;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Owns one dedicated thread bound to a single {@link DataCollector}.
 *
 * <p>The thread receives {@code Run} and {@code Terminate} commands from a FIFO queue and
 * publishes its lifecycle through a lock-guarded state cell. Other threads observe state
 * changes through {@link #awaitIdle()} without polling.
 *
 * <p>Collector failures never escape the worker: they are logged with the worker name,
 * handed to the failure handler and the worker returns to {@link CollectorState#IDLE}.
 *
 * <p>Workers are created and destroyed only by {@link CollectorScheduler}.
 */
@Slf4j
public class CollectorWorker {

    private sealed interface Command permits Run, Terminate {
    }

    private record Run(DataModel model) implements Command {
    }

    private record Terminate() implements Command {
    }

    @Getter
    private final CollectorHandle handle;
    @Getter
    private final UUID groupId;
    @Getter
    private final String name;
    @Getter
    private final Set<UUID> dependencies;

    private final DataCollector collector;
    private final BiConsumer<String, Throwable> failureHandler;
    private final BlockingQueue<Command> queue = new LinkedBlockingQueue<>();
    private final Thread thread;

    private final Lock stateLock = new ReentrantLock();
    private final Condition stateChanged = stateLock.newCondition();
    private CollectorState state = CollectorState.IDLE;
    private boolean terminationRequested;

    /**
     * Create a worker. The backing thread is not started until {@link #start()}.
     *
     * @param handle         Registry handle
     * @param groupId        Group (plugin instance) the collector belongs to
     * @param name           Human-readable name used in logs
     * @param dependencies   Groups that must finish before this collector runs
     * @param collector      Collector to invoke
     * @param failureHandler Receives the worker name and failure of every failed run
     * @param threadName     Name of the backing thread
     * @param daemon         Whether the backing thread is a daemon thread
     */
    public CollectorWorker(CollectorHandle handle,
                           UUID groupId,
                           String name,
                           Set<UUID> dependencies,
                           DataCollector collector,
                           BiConsumer<String, Throwable> failureHandler,
                           String threadName,
                           boolean daemon) {
        this.handle = Objects.requireNonNull(handle, "Handle must not be null");
        this.groupId = Objects.requireNonNull(groupId, "Group id must not be null");
        this.name = Objects.requireNonNull(name, "Name must not be null");
        this.dependencies = Set.copyOf(dependencies);
        this.collector = Objects.requireNonNull(collector, "Collector must not be null");
        this.failureHandler = Objects.requireNonNull(failureHandler, "Failure handler must not be null");
        this.thread = new Thread(this::receiveLoop, threadName);
        this.thread.setDaemon(daemon);
    }

    /**
     * Start the backing thread.
     */
    public void start() {
        thread.start();
        log.debug("Started worker thread '{}' for collector {}", thread.getName(), name);
    }

    /**
     * Request one run of the collector against the given model.
     *
     * <p>Marks the worker {@link CollectorState#SCHEDULED} and enqueues the run. Runs
     * requested while a previous one is executing are processed afterwards, in order.
     * Rejected once the worker has terminated or termination has been requested.
     *
     * @param model Shared data model passed to the collector
     * @return {@code true} if the run was enqueued, {@code false} if it was rejected
     */
    public boolean run(DataModel model) {
        Objects.requireNonNull(model, "Model must not be null");
        stateLock.lock();
        try {
            if (terminationRequested || state == CollectorState.TERMINATED) {
                log.debug("Rejecting run request for terminated collector {}", name);
                return false;
            }
            setState(CollectorState.SCHEDULED);
            queue.add(new Run(model));
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Terminate the worker and block until its thread has exited.
     *
     * <p>Runs enqueued before this call are still processed. Interrupts received while
     * waiting are deferred and restored once the thread has been joined.
     *
     * @throws IllegalStateException If called from the worker's own thread
     */
    public void terminate() {
        if (Thread.currentThread() == thread) {
            throw new IllegalStateException("Collector " + name + " cannot terminate itself");
        }
        stateLock.lock();
        try {
            if (!terminationRequested) {
                terminationRequested = true;
                queue.add(new Terminate());
            }
        } finally {
            stateLock.unlock();
        }

        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        log.debug("Worker for collector {} terminated", name);
    }

    /**
     * Block until the worker is {@link CollectorState#IDLE} or
     * {@link CollectorState#TERMINATED}.
     *
     * @return The state observed when the wait ended
     */
    public CollectorState awaitIdle() {
        stateLock.lock();
        try {
            while (state != CollectorState.IDLE && state != CollectorState.TERMINATED) {
                stateChanged.awaitUninterruptibly();
            }
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return Current state, a point-in-time read
     */
    public CollectorState getState() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return Whether the backing thread is still alive
     */
    public boolean isAlive() {
        return thread.isAlive();
    }

    private void receiveLoop() {
        while (true) {
            Command command;
            try {
                command = queue.take();
            } catch (InterruptedException e) {
                log.warn("Worker for collector {} interrupted, terminating", name);
                transition(CollectorState.TERMINATED);
                return;
            }

            if (command instanceof Run run) {
                execute(run.model());
            } else {
                transition(CollectorState.TERMINATED);
                return;
            }
        }
    }

    private void execute(DataModel model) {
        transition(CollectorState.RUNNING);
        long start = System.currentTimeMillis();
        try {
            log.debug("Running collector: {}", name);
            collector.collect(model);
        } catch (Exception | Error e) {
            // errors too: the receive loop must outlive any collector
            log.error("Collector {} failed: {}", name, e.getMessage(), e);
            failureHandler.accept(name, e);
        } finally {
            log.debug("Collector {} completed in {} ms", name, System.currentTimeMillis() - start);
            transition(CollectorState.IDLE);
        }
    }

    private void transition(CollectorState next) {
        stateLock.lock();
        try {
            setState(next);
        } finally {
            stateLock.unlock();
        }
    }

    // Caller must hold stateLock.
    private void setState(CollectorState next) {
        if (state == CollectorState.TERMINATED) {
            return;
        }
        state = next;
        stateChanged.signalAll();
    }
}
