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

import org.greengagedb.harvester.model.DataModel;

/**
 * A unit of work that reads and writes the shared {@link DataModel} once per invocation.
 *
 * <p>Each registered collector is invoked by exactly one dedicated worker thread, one
 * run at a time. Several collectors of the same scheduling layer run concurrently
 * against the same model, so any coordination over the model contents is up to the
 * collectors and the model.
 */
@FunctionalInterface
public interface DataCollector {

    /**
     * Run the collector once.
     *
     * @param model Shared data model (never null)
     * @throws CollectorException If collection fails (logged by the worker, never propagated)
     */
    void collect(DataModel model) throws CollectorException;
}
