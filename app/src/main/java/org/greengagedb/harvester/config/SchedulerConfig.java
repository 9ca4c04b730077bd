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

/**
 * Configuration of collector worker threads.
 */
@ConfigMapping(prefix = "app.scheduler")
public interface SchedulerConfig {

    /**
     * Prefix of worker thread names. The handle and collector name are appended.
     *
     * @return Thread name prefix (default: "collector-")
     */
    @WithDefault("collector-")
    String threadNamePrefix();

    /**
     * Whether worker threads are daemon threads, so a collector that never returns
     * does not keep the JVM alive on shutdown.
     *
     * @return true for daemon threads (default: true)
     */
    @WithDefault("true")
    boolean daemonThreads();
}
