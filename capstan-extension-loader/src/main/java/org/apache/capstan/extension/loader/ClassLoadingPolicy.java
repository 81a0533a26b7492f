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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.net.URL;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Parent-first package prefixes for plugin directory class loaders.
 *
 * <p>The prefixes in {@link ChildFirstClassLoader#DEFAULT_PARENT_FIRST_PACKAGES}
 * are always included so the extension API types are shared with the host.
 * Applications add the packages of their own extension interfaces on top.
 */
public final class ClassLoadingPolicy {

    private final List<String> parentFirstPrefixes;

    public ClassLoadingPolicy(List<String> applicationPrefixes) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES);
        if (applicationPrefixes != null) {
            for (String prefix : applicationPrefixes) {
                String trimmed = Strings.nullToEmpty(prefix).trim();
                if (!trimmed.isEmpty()) {
                    merged.add(trimmed);
                }
            }
        }
        this.parentFirstPrefixes = ImmutableList.copyOf(merged);
    }

    public static ClassLoadingPolicy defaultPolicy() {
        return new ClassLoadingPolicy(null);
    }

    public static ClassLoadingPolicy withParentFirst(String... applicationPrefixes) {
        return new ClassLoadingPolicy(Arrays.asList(applicationPrefixes));
    }

    public List<String> getParentFirstPrefixes() {
        return parentFirstPrefixes;
    }

    public ChildFirstClassLoader createClassLoader(URL[] urls, ClassLoader parent) {
        return new ChildFirstClassLoader(urls, parent, parentFirstPrefixes);
    }
}
