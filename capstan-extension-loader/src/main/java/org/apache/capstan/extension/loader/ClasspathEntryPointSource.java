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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists entry points from the registry resources visible to a class loader.
 *
 * <p>Every {@code META-INF/capstan/extensions/<namespace>} resource on the class
 * path contributes its entries, in resource order and then line order.
 */
public class ClasspathEntryPointSource implements EntryPointSource {

    private final ClassLoader classLoader;

    public ClasspathEntryPointSource() {
        this(defaultClassLoader());
    }

    public ClasspathEntryPointSource(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    @Override
    public List<EntryPoint> listEntryPoints(String namespace) throws ExtensionException {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace is empty");
        String resourceName = EntryPointRegistryReader.resourceName(namespace);
        try {
            return new ArrayList<>(EntryPointRegistryReader.readAll(
                    classLoader.getResources(resourceName), namespace, classLoader));
        } catch (IOException e) {
            throw new ExtensionException("Failed to read extension registry " + resourceName, e);
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ClasspathEntryPointSource.class.getClassLoader();
    }
}
