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

/**
 * Opaque identifier of a registered collector.
 *
 * <p>Handles are drawn from a counter starting at 1 and are never reused by the
 * scheduler that issued them, even after the collector has been removed.
 * Ordering follows issue order, which is also registration order.
 *
 * @param value Numeric handle value
 */
public record CollectorHandle(long value) implements Comparable<CollectorHandle> {

    public CollectorHandle {
        if (value < 1) {
            throw new IllegalArgumentException("Handle value must be positive: " + value);
        }
    }

    @Override
    public int compareTo(CollectorHandle other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
