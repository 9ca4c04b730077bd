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

/**
 * Identity of a plugin. Plugins declare their dependencies by descriptor.
 *
 * @param name Unique plugin name
 */
public record PluginDescriptor(String name) {

    public PluginDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name must not be blank");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
