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
package org.greengagedb.harvester.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration of periodic collection passes.
 */
@ConfigMapping(prefix = "app.collection")
public interface CollectionConfig {

    /**
     * Interval between periodic collection passes.
     *
     * @return Pass interval (default: 60 seconds)
     */
    @WithDefault("60s")
    Duration interval();

    /**
     * Whether to run one collection pass right after startup.
     *
     * @return true to collect on startup (default: true)
     */
    @WithDefault("true")
    boolean runOnStartup();

    /**
     * Age after which the last pass result is considered stale.
     *
     * @return Maximum result age (default: 5 minutes)
     */
    @WithDefault("5m")
    Duration resultMaxAge();
}
