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

import org.apache.capstan.extension.EntryPoint;
import org.apache.capstan.extension.EntryPointSource;
import org.apache.capstan.extension.ExtensionException;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Entry point source backed by programmatic registrations.
 *
 * <p>Useful for embedding applications that assemble their extensions in code,
 * and for tests that need real discovery without registry resources.
 * Entries are listed in registration order.
 */
public final class StaticEntryPointSource implements EntryPointSource {

    private final ListMultimap<String, EntryPoint> entryPointsByNamespace;

    private StaticEntryPointSource(Builder builder) {
        this.entryPointsByNamespace = builder.entryPoints.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<EntryPoint> listEntryPoints(String namespace) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace is empty");
        return entryPointsByNamespace.get(namespace);
    }

    /**
     * Builder for {@link StaticEntryPointSource}.
     */
    public static final class Builder {
        private final ImmutableListMultimap.Builder<String, EntryPoint> entryPoints =
                ImmutableListMultimap.builder();

        private Builder() {
        }

        /**
         * Registers an already loaded plugin object.
         *
         * @param namespace namespace
         * @param name extension name
         * @param plugin plugin object
         * @return this builder
         */
        public Builder register(String namespace, String name, Object plugin) {
            Objects.requireNonNull(plugin, "plugin");
            String target = plugin instanceof Class ? ((Class<?>) plugin).getName() : plugin.getClass().getName();
            return add(new StaticEntryPoint(namespace, name, target, () -> plugin));
        }

        /**
         * Registers a plugin that is loaded lazily when the entry point is resolved.
         *
         * @param namespace namespace
         * @param name extension name
         * @param target textual description of what the resolver returns
         * @param resolver loads the plugin; exceptions become load failures
         * @return this builder
         */
        public Builder register(String namespace, String name, String target, Callable<?> resolver) {
            return add(new StaticEntryPoint(namespace, name, target, resolver));
        }

        public Builder add(EntryPoint entryPoint) {
            Objects.requireNonNull(entryPoint, "entryPoint");
            entryPoints.put(entryPoint.getNamespace(), entryPoint);
            return this;
        }

        public StaticEntryPointSource build() {
            return new StaticEntryPointSource(this);
        }
    }

    private static final class StaticEntryPoint implements EntryPoint {
        private final String namespace;
        private final String name;
        private final String target;
        private final Callable<?> resolver;

        private StaticEntryPoint(String namespace, String name, String target, Callable<?> resolver) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace is empty");
            Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "name is empty");
            this.namespace = namespace;
            this.name = name;
            this.target = Strings.isNullOrEmpty(target) ? name : target;
            this.resolver = Objects.requireNonNull(resolver, "resolver");
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getNamespace() {
            return namespace;
        }

        @Override
        public String getTarget() {
            return target;
        }

        @Override
        public Object resolve() {
            Object plugin;
            try {
                plugin = resolver.call();
            } catch (ExtensionException e) {
                throw e;
            } catch (Exception e) {
                throw new ExtensionException("Failed to resolve extension " + name, e);
            }
            if (plugin == null) {
                throw new ExtensionException("Resolver for extension " + name + " returned null");
            }
            return plugin;
        }

        @Override
        public String toString() {
            return namespace + ":" + name + " = " + target;
        }
    }
}
