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
package org.greengagedb.harvester.model;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared store that collectors read from and write to.
 *
 * <p>Components are keyed by their type, so a collector publishes a result object and
 * later collectors look it up by class. At most one component per type is held.
 *
 * <p><b>Thread Safety:</b> all operations are safe to call from concurrently running
 * collectors. Compound read-modify-write sequences are not atomic.
 */
@ApplicationScoped
public class DataModel {

    private final Map<Class<?>, Object> components = new ConcurrentHashMap<>();

    /**
     * Look up the component stored for a type.
     *
     * @param type Component type
     * @param <T>  Component type
     * @return The component, or empty if none is stored
     */
    public <T> Optional<T> get(Class<T> type) {
        Objects.requireNonNull(type, "Type must not be null");
        return Optional.ofNullable(components.get(type)).map(type::cast);
    }

    /**
     * Store a component under its runtime class, replacing any previous one.
     *
     * @param component Component to store (never null)
     * @param <T>       Component type
     */
    public <T> void set(T component) {
        Objects.requireNonNull(component, "Component must not be null");
        components.put(component.getClass(), component);
    }

    /**
     * Store a component under an explicit type, replacing any previous one.
     *
     * @param type      Key type
     * @param component Component to store (never null)
     * @param <T>       Component type
     */
    public <T> void set(Class<T> type, T component) {
        Objects.requireNonNull(type, "Type must not be null");
        Objects.requireNonNull(component, "Component must not be null");
        components.put(type, type.cast(component));
    }

    /**
     * Remove the component stored for a type.
     *
     * @param type Component type
     * @param <T>  Component type
     * @return The removed component, or empty if none was stored
     */
    public <T> Optional<T> remove(Class<T> type) {
        Objects.requireNonNull(type, "Type must not be null");
        return Optional.ofNullable(components.remove(type)).map(type::cast);
    }

    public boolean contains(Class<?> type) {
        return components.containsKey(type);
    }

    /**
     * @return Snapshot of the stored component types
     */
    public Set<Class<?>> types() {
        return Set.copyOf(components.keySet());
    }

    public void clear() {
        components.clear();
    }
}
