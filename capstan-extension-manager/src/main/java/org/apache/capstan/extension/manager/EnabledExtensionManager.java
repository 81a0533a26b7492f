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

import org.apache.capstan.extension.Extension;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Extension manager that keeps only the extensions passing a check function.
 *
 * <p>The check receives the fully loaded {@link Extension}, so it can look at the
 * name, the plugin and the invocation result. Rejected extensions produce one
 * DEBUG record and are otherwise invisible. The same check is applied when the
 * manager is built from pre-built extensions with
 * {@link #makeTestInstance(List, Predicate, boolean)}, so a test instance holds
 * exactly what discovery would have kept.
 *
 * <p>The check must not throw. If it does, the exception is propagated out of
 * the constructor or factory method and no manager is created.
 */
public class EnabledExtensionManager extends ExtensionManager {
    private static final Logger LOG = LogManager.getLogger(EnabledExtensionManager.class);

    private final Predicate<Extension> checkFunc;

    /**
     * Discovers and loads extensions, keeping those for which {@code checkFunc} returns true.
     *
     * @param config manager settings
     * @param checkFunc decides which extensions are enabled
     */
    public EnabledExtensionManager(ExtensionManagerConfig config, Predicate<Extension> checkFunc) {
        super(config, enabledFilter(checkFunc));
        this.checkFunc = checkFunc;
    }

    private EnabledExtensionManager(String namespace, List<Extension> extensions, boolean propagateMapExceptions,
            Predicate<Extension> checkFunc) {
        super(namespace, extensions, propagateMapExceptions);
        this.checkFunc = checkFunc;
    }

    public static EnabledExtensionManager makeTestInstance(List<Extension> availableExtensions,
            Predicate<Extension> checkFunc) {
        return makeTestInstance(availableExtensions, checkFunc, false);
    }

    /**
     * Builds a manager from pre-built extensions, dropping those rejected by {@code checkFunc}.
     *
     * @param availableExtensions candidate extensions in discovery order
     * @param checkFunc decides which extensions are enabled
     * @param propagateMapExceptions map exception policy
     * @return manager in the {@link #TEST_NAMESPACE} namespace
     */
    public static EnabledExtensionManager makeTestInstance(List<Extension> availableExtensions,
            Predicate<Extension> checkFunc, boolean propagateMapExceptions) {
        Objects.requireNonNull(availableExtensions, "availableExtensions");
        List<Extension> enabled = availableExtensions.stream()
                .filter(enabledFilter(checkFunc))
                .collect(Collectors.toList());
        return new EnabledExtensionManager(TEST_NAMESPACE, enabled, propagateMapExceptions, checkFunc);
    }

    public Predicate<Extension> getCheckFunc() {
        return checkFunc;
    }

    private static Predicate<Extension> enabledFilter(Predicate<Extension> checkFunc) {
        Objects.requireNonNull(checkFunc, "checkFunc");
        return extension -> {
            if (checkFunc.test(extension)) {
                return true;
            }
            LOG.debug("Ignoring extension: name={}", extension.getName());
            return false;
        };
    }
}
