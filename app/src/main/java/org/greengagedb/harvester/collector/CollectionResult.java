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
package org.greengagedb.harvester.collector;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a collection pass, including timing and status information.
 *
 * @param timestamp  When the pass started
 * @param successful Whether every layer of the pass was scheduled
 * @param error      Optional error if the pass failed
 */
public record CollectionResult(Instant timestamp, boolean successful, Throwable error) {

    /**
     * Create a successful pass result.
     *
     * @param start When the pass started
     * @return Successful pass result
     */
    public static CollectionResult successful(Instant start) {
        return new CollectionResult(start, true, null);
    }

    /**
     * Create a failed pass result with error details.
     *
     * @param start When the pass started
     * @param error The error that caused the failure
     * @return Failed pass result with error
     */
    public static CollectionResult failed(Instant start, Throwable error) {
        return new CollectionResult(start, false, error);
    }

    /**
     * Check if this result is too old to describe the current state of the model.
     *
     * @param maxAge Maximum age before result is considered stale
     * @return true if the result is older than maxAge
     */
    public boolean isStale(Duration maxAge) {
        return getAge().compareTo(maxAge) > 0;
    }

    /**
     * Get the age of this result.
     *
     * @return Duration since the pass started
     */
    public Duration getAge() {
        return Duration.between(timestamp, Instant.now());
    }
}
