// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.capstan.extension.loader;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One scanned plugin directory together with the class loader built over its jars.
 */
public final class PluginDirectory {

    private final Path pluginDir;
    private final List<Path> resolvedJars;
    private final ChildFirstClassLoader classLoader;

    public PluginDirectory(Path pluginDir, List<Path> resolvedJars, ChildFirstClassLoader classLoader) {
        this.pluginDir = Objects.requireNonNull(pluginDir, "pluginDir");
        this.resolvedJars = ImmutableList.copyOf(Objects.requireNonNull(resolvedJars, "resolvedJars"));
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    public String getDirectoryName() {
        return pluginDir.getFileName().toString();
    }

    public List<Path> getResolvedJars() {
        return resolvedJars;
    }

    public ChildFirstClassLoader getClassLoader() {
        return classLoader;
    }
}
