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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DataModelTest {

    record Packages(List<String> names) {
    }

    interface Routes {
    }

    record StaticRoutes(int count) implements Routes {
    }

    @Test
    void testGet_EmptyModel() {
        DataModel model = new DataModel();

        assertEquals(Optional.empty(), model.get(Packages.class));
        assertFalse(model.contains(Packages.class));
        assertTrue(model.types().isEmpty());
    }

    @Test
    void testSet_ReplacesPreviousComponent() {
        DataModel model = new DataModel();

        model.set(new Packages(List.of("a")));
        model.set(new Packages(List.of("a", "b")));

        assertEquals(Optional.of(new Packages(List.of("a", "b"))), model.get(Packages.class));
        assertEquals(Set.of(Packages.class), model.types());
    }

    @Test
    void testSet_WithExplicitType() {
        DataModel model = new DataModel();

        model.set(Routes.class, new StaticRoutes(4));

        assertEquals(Optional.of(new StaticRoutes(4)), model.get(Routes.class));
        assertEquals(Optional.empty(), model.get(StaticRoutes.class));
    }

    @Test
    void testSet_RejectsNull() {
        DataModel model = new DataModel();

        assertThrows(NullPointerException.class, () -> model.set(null));
        assertThrows(NullPointerException.class, () -> model.set(Routes.class, null));
    }

    @Test
    void testRemove() {
        DataModel model = new DataModel();
        model.set(new Packages(List.of("a")));

        assertEquals(Optional.of(new Packages(List.of("a"))), model.remove(Packages.class));
        assertEquals(Optional.empty(), model.remove(Packages.class));
        assertFalse(model.contains(Packages.class));
    }

    @Test
    void testClear() {
        DataModel model = new DataModel();
        model.set(new Packages(List.of()));
        model.set(new StaticRoutes(1));

        model.clear();

        assertTrue(model.types().isEmpty());
    }
}
