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

import org.apache.capstan.extension.ExtensionException;
import org.apache.capstan.extension.ExtensionFactory;
import org.apache.capstan.extension.InvocationArguments;

import java.lang.reflect.Constructor;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Invokes the plugin shapes the entry point sources produce.
 *
 * <ul>
 *   <li>{@link ExtensionFactory}: {@code create(arguments)}</li>
 *   <li>{@link Class}: a public constructor taking {@link InvocationArguments} if
 *       one exists, otherwise a public constructor matching the positional
 *       arguments; named arguments are rejected in that case</li>
 *   <li>{@link Supplier}: {@code get()}, only without arguments</li>
 * </ul>
 */
public final class DefaultPluginInvoker implements PluginInvoker {

    public static final DefaultPluginInvoker INSTANCE = new DefaultPluginInvoker();

    private DefaultPluginInvoker() {
    }

    @Override
    public Object invoke(Object plugin, InvocationArguments arguments) throws Exception {
        if (plugin instanceof ExtensionFactory) {
            return ((ExtensionFactory) plugin).create(arguments);
        }
        if (plugin instanceof Class) {
            return instantiate((Class<?>) plugin, arguments);
        }
        if (plugin instanceof Supplier) {
            if (!arguments.isEmpty()) {
                throw new ExtensionException("Supplier plugin " + plugin.getClass().getName()
                        + " does not accept invoke arguments");
            }
            return ((Supplier<?>) plugin).get();
        }
        throw new ExtensionException("Plugin of type " + plugin.getClass().getName() + " is not invocable");
    }

    private static Object instantiate(Class<?> type, InvocationArguments arguments) throws Exception {
        Optional<Constructor<?>> argumentsConstructor =
                Reflections.findConstructor(type, Collections.singletonList(arguments));
        if (argumentsConstructor.isPresent()) {
            return Reflections.newInstance(argumentsConstructor.get(), arguments);
        }
        if (arguments.hasNamed()) {
            throw new ExtensionException("Class " + type.getName()
                    + " has no constructor accepting InvocationArguments, named arguments "
                    + arguments.getNamed().keySet() + " cannot be passed");
        }
        Constructor<?> constructor = Reflections.findConstructor(type, arguments.getPositional())
                .orElseThrow(() -> new ExtensionException("Class " + type.getName()
                        + " has no public constructor for " + arguments.getPositional().size() + " argument(s)"));
        return Reflections.newInstance(constructor, arguments.getPositional().toArray());
    }
}
