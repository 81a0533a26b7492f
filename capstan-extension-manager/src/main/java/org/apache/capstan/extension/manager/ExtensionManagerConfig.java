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

package org.apache.capstan.extension.manager;

import org.apache.capstan.extension.EntryPointSource;
import org.apache.capstan.extension.InvocationArguments;
import org.apache.capstan.extension.loader.ClasspathEntryPointSource;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Construction settings for an {@link ExtensionManager}.
 *
 * <p>Immutable; use {@link #builder(String)} or {@link #fromProperties(Map)}.
 * Every setting is fixed for the lifetime of the manager built from it.
 */
public final class ExtensionManagerConfig {

    public static final String PROP_NAMESPACE = "namespace";
    public static final String PROP_INVOKE_ON_LOAD = "invoke_on_load";
    public static final String PROP_PROPAGATE_MAP_EXCEPTIONS = "propagate_map_exceptions";
    public static final String PROP_WARN_ON_MISSING_ENTRYPOINT = "warn_on_missing_entrypoint";

    private final String namespace;
    private final EntryPointSource entryPointSource;
    private final boolean invokeOnLoad;
    private final InvocationArguments invokeArguments;
    private final boolean propagateMapExceptions;
    private final boolean warnOnMissingEntrypoint;
    private final PluginInvoker pluginInvoker;
    private final LoadFailureCallback onLoadFailureCallback;

    private ExtensionManagerConfig(Builder builder) {
        this.namespace = builder.namespace;
        this.entryPointSource = builder.entryPointSource != null
                ? builder.entryPointSource
                : new ClasspathEntryPointSource();
        this.invokeOnLoad = builder.invokeOnLoad;
        this.invokeArguments = builder.invokeArguments;
        this.propagateMapExceptions = builder.propagateMapExceptions;
        this.warnOnMissingEntrypoint = builder.warnOnMissingEntrypoint;
        this.pluginInvoker = builder.pluginInvoker;
        this.onLoadFailureCallback = builder.onLoadFailureCallback;
    }

    public static Builder builder(String namespace) {
        return new Builder(namespace);
    }

    /**
     * Creates a builder from string properties.
     *
     * <p>Recognised keys: {@value #PROP_NAMESPACE} (required),
     * {@value #PROP_INVOKE_ON_LOAD}, {@value #PROP_PROPAGATE_MAP_EXCEPTIONS} and
     * {@value #PROP_WARN_ON_MISSING_ENTRYPOINT}. Booleans must be {@code true} or
     * {@code false}. Unknown keys are ignored.
     *
     * @param properties configuration properties
     * @return builder pre-populated from the properties
     * @throws IllegalArgumentException if the namespace is missing or a boolean is malformed
     */
    public static Builder fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = new Builder(properties.get(PROP_NAMESPACE));
        parseBoolean(properties, PROP_INVOKE_ON_LOAD).ifPresent(builder::invokeOnLoad);
        parseBoolean(properties, PROP_PROPAGATE_MAP_EXCEPTIONS).ifPresent(builder::propagateMapExceptions);
        parseBoolean(properties, PROP_WARN_ON_MISSING_ENTRYPOINT).ifPresent(builder::warnOnMissingEntrypoint);
        return builder;
    }

    private static Optional<Boolean> parseBoolean(Map<String, String> properties, String key) {
        String raw = Strings.nullToEmpty(properties.get(key)).trim();
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if ("true".equalsIgnoreCase(raw)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(raw)) {
            return Optional.of(Boolean.FALSE);
        }
        throw new IllegalArgumentException("Property " + key + " must be true or false, got '" + raw + "'");
    }

    public String getNamespace() {
        return namespace;
    }

    public EntryPointSource getEntryPointSource() {
        return entryPointSource;
    }

    public boolean isInvokeOnLoad() {
        return invokeOnLoad;
    }

    public InvocationArguments getInvokeArguments() {
        return invokeArguments;
    }

    public boolean isPropagateMapExceptions() {
        return propagateMapExceptions;
    }

    public boolean isWarnOnMissingEntrypoint() {
        return warnOnMissingEntrypoint;
    }

    public PluginInvoker getPluginInvoker() {
        return pluginInvoker;
    }

    public Optional<LoadFailureCallback> getOnLoadFailureCallback() {
        return Optional.ofNullable(onLoadFailureCallback);
    }

    @Override
    public String toString() {
        return "ExtensionManagerConfig{"
                + "namespace='" + namespace + '\''
                + ", invokeOnLoad=" + invokeOnLoad
                + ", invokeArguments=" + invokeArguments
                + ", propagateMapExceptions=" + propagateMapExceptions
                + ", warnOnMissingEntrypoint=" + warnOnMissingEntrypoint
                + '}';
    }

    /**
     * Builder for {@link ExtensionManagerConfig}.
     */
    public static final class Builder {
        private final String namespace;
        private EntryPointSource entryPointSource;
        private boolean invokeOnLoad;
        private InvocationArguments invokeArguments = InvocationArguments.empty();
        private boolean propagateMapExceptions;
        private boolean warnOnMissingEntrypoint = true;
        private PluginInvoker pluginInvoker = DefaultPluginInvoker.INSTANCE;
        private LoadFailureCallback onLoadFailureCallback;

        private Builder(String namespace) {
            Preconditions.checkArgument(!Strings.nullToEmpty(namespace).trim().isEmpty(), "namespace is required");
            this.namespace = namespace.trim();
        }

        /**
         * Sets where entry points are discovered. Defaults to the registry resources
         * visible to the thread context class loader.
         *
         * @param entryPointSource discovery collaborator
         * @return this builder
         */
        public Builder entryPointSource(EntryPointSource entryPointSource) {
            this.entryPointSource = entryPointSource;
            return this;
        }

        public Builder invokeOnLoad(boolean invokeOnLoad) {
            this.invokeOnLoad = invokeOnLoad;
            return this;
        }

        /**
         * Sets the arguments passed to each plugin when invoke-on-load is enabled.
         *
         * @param invokeArguments arguments, null resets to none
         * @return this builder
         */
        public Builder invokeArguments(InvocationArguments invokeArguments) {
            this.invokeArguments = invokeArguments != null ? invokeArguments : InvocationArguments.empty();
            return this;
        }

        public Builder propagateMapExceptions(boolean propagateMapExceptions) {
            this.propagateMapExceptions = propagateMapExceptions;
            return this;
        }

        public Builder warnOnMissingEntrypoint(boolean warnOnMissingEntrypoint) {
            this.warnOnMissingEntrypoint = warnOnMissingEntrypoint;
            return this;
        }

        public Builder pluginInvoker(PluginInvoker pluginInvoker) {
            this.pluginInvoker = Objects.requireNonNull(pluginInvoker, "pluginInvoker");
            return this;
        }

        public Builder onLoadFailureCallback(LoadFailureCallback onLoadFailureCallback) {
            this.onLoadFailureCallback = onLoadFailureCallback;
            return this;
        }

        public ExtensionManagerConfig build() {
            return new ExtensionManagerConfig(this);
        }
    }
}
