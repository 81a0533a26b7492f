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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;

/**
 * Parses extension registry resources.
 *
 * <p>A registry resource lives at {@code META-INF/capstan/extensions/<namespace>}
 * and holds one {@code name = target} entry per line. A {@code #} at the start of
 * a line or after whitespace begins a comment; blank lines are ignored.
 */
final class EntryPointRegistryReader {
    private static final Logger LOG = LogManager.getLogger(EntryPointRegistryReader.class);

    static final String REGISTRY_DIRECTORY = "META-INF/capstan/extensions/";

    private EntryPointRegistryReader() {
    }

    static String resourceName(String namespace) {
        return REGISTRY_DIRECTORY + namespace;
    }

    static List<ClassEntryPoint> readAll(Enumeration<URL> resources, String namespace, ClassLoader classLoader)
            throws IOException {
        List<ClassEntryPoint> entryPoints = new ArrayList<>();
        while (resources.hasMoreElements()) {
            entryPoints.addAll(read(resources.nextElement(), namespace, classLoader));
        }
        return entryPoints;
    }

    static List<ClassEntryPoint> read(URL resource, String namespace, ClassLoader classLoader) throws IOException {
        List<ClassEntryPoint> entryPoints = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.openStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = stripComment(line).trim();
                if (line.isEmpty()) {
                    continue;
                }
                int eq = line.indexOf('=');
                String name = eq > 0 ? line.substring(0, eq).trim() : "";
                String target = eq > 0 ? line.substring(eq + 1).trim() : "";
                if (name.isEmpty() || target.isEmpty()) {
                    LOG.warn("Skip malformed extension entry: resource={}, line={}, text='{}'",
                            resource, lineNumber, line);
                    continue;
                }
                entryPoints.add(new ClassEntryPoint(name, namespace, target, classLoader, resource));
            }
        }
        return entryPoints;
    }

    /**
     * Removes a trailing comment. A {@code #} starts a comment at the start of the
     * line or after whitespace; anywhere else it selects a static field.
     */
    static String stripComment(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '#' && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return line.substring(0, i);
            }
        }
        return line;
    }
}
