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

package org.apache.capstan.extension;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Objects;
import java.util.Optional;

/**
 * One loaded extension: a name, the entry point it came from, the loaded plugin
 * object and, when the manager invoked the plugin on load, the invocation result.
 *
 * <p>Instances are immutable and hold no reference to the manager that owns them.
 */
public final class Extension {

    private final String name;
    private final EntryPoint entryPoint;
    private final Object plugin;
    private final Object obj;

    /**
     * Creates an extension.
     *
     * @param name extension name
     * @param entryPoint entry point the plugin was resolved from, null for hand-built extensions
     * @param plugin loaded plugin object
     * @param obj invocation result, null when the plugin was not invoked
     */
    public Extension(String name, EntryPoint entryPoint, Object plugin, Object obj) {
        Preconditions.checkArgument(!Strings.nullToEmpty(name).trim().isEmpty(), "extension name is blank");
        this.name = name;
        this.entryPoint = entryPoint;
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.obj = obj;
    }

    public String getName() {
        return name;
    }

    public Optional<EntryPoint> getEntryPoint() {
        return Optional.ofNullable(entryPoint);
    }

    /**
     * Returns the textual target of the entry point, e.g. {@code com.example.Foo}.
     *
     * @return target, or empty for hand-built extensions
     */
    public Optional<String> getEntryPointTarget() {
        return getEntryPoint().map(EntryPoint::getTarget);
    }

    public Object getPlugin() {
        return plugin;
    }

    /**
     * Returns the invocation result.
     *
     * @return result, or empty if the plugin was not invoked on load
     */
    public Optional<Object> getObj() {
        return Optional.ofNullable(obj);
    }

    /**
     * Returns the invocation result cast to the expected type.
     *
     * @param type expected type
     * @param <T> expected type
     * @return the invocation result
     * @throws ExtensionException if there is no result or it has another type
     */
    public <T> T getObj(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (obj == null) {
            throw new ExtensionException("Extension '" + name + "' was not invoked on load");
        }
        if (!type.isInstance(obj)) {
            throw new ExtensionException("Extension '" + name + "' produced " + obj.getClass().getName()
                    + ", not " + type.getName());
        }
        return type.cast(obj);
    }

    @Override
    public String toString() {
        return "Extension{"
                + "name='" + name + '\''
                + ", target=" + getEntryPointTarget().orElse("<none>")
                + ", invoked=" + (obj != null)
                + '}';
    }
}
