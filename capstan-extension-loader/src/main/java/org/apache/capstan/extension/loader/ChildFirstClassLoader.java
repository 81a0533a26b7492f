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

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Class loader for one plugin directory: classes are looked up in the plugin's own
 * jars first, except for packages on the parent-first list.
 */
public class ChildFirstClassLoader extends URLClassLoader {

    public static final List<String> DEFAULT_PARENT_FIRST_PACKAGES = ImmutableList.of(
            "java.",
            "javax.",
            "sun.",
            "com.sun.",
            "org.slf4j.",
            "org.apache.logging.",
            "org.apache.capstan.extension.");

    private final List<String> parentFirstPackages;

    public ChildFirstClassLoader(URL[] urls, ClassLoader parent, List<String> parentFirstPackages) {
        super(urls, parent);
        this.parentFirstPackages = parentFirstPackages != null
                ? ImmutableList.copyOf(parentFirstPackages)
                : DEFAULT_PARENT_FIRST_PACKAGES;
    }

    public List<String> getParentFirstPackages() {
        return parentFirstPackages;
    }

    /**
     * Returns the resources with the given name found in this loader's own jars,
     * ignoring everything visible through the parent.
     *
     * @param name resource name
     * @return matching resources in jar order
     * @throws IOException if a jar cannot be read
     */
    public Enumeration<URL> findOwnResources(String name) throws IOException {
        Enumeration<URL> own = findResources(name);
        return own != null ? own : Collections.emptyEnumeration();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> loaded = findLoadedClass(name);
            if (loaded != null) {
                return loaded;
            }
            if (isParentFirst(name)) {
                return super.loadClass(name, resolve);
            }
            try {
                Class<?> clazz = findClass(name);
                if (resolve) {
                    resolveClass(clazz);
                }
                return clazz;
            } catch (ClassNotFoundException notInPlugin) {
                return super.loadClass(name, resolve);
            }
        }
    }

    private boolean isParentFirst(String className) {
        for (String prefix : parentFirstPackages) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
