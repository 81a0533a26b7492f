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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists entry points from plugin directories laid out under one or more plugin roots.
 *
 * <h2>Layout</h2>
 *
 * <p>Each direct subdirectory of a root is one plugin directory. Its jars are
 * {@code pluginDir/*.jar} plus {@code pluginDir/lib/*.jar}. The registry resource
 * {@code META-INF/capstan/extensions/<namespace>} is read from those jars only,
 * never from the parent class path, and the entries it names are loaded through a
 * per-directory {@link ChildFirstClassLoader}.
 *
 * <h2>Ordering</h2>
 *
 * <p>Roots are visited in the given order and plugin directories in file-name
 * order within a root, so the entry point order is stable across runs.
 *
 * <h2>Failure Semantics</h2>
 *
 * <p>Problems with one root or plugin directory are recorded as a staged
 * {@link LoadFailure} and logged; the remaining directories are still used.
 * Failures are available through {@link #getFailures()}.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>Directories are scanned once, on first use. {@link #close()} closes every
 * plugin class loader; loaded plugin classes must not be used afterwards and
 * listing entry points from a closed source fails with {@link IllegalStateException}.
 */
public class DirectoryEntryPointSource implements EntryPointSource, Closeable {
    private static final Logger LOG = LogManager.getLogger(DirectoryEntryPointSource.class);

    private final List<Path> pluginRoots;
    private final ClassLoader parent;
    private final ClassLoadingPolicy policy;
    private final Object lifecycleLock = new Object();

    private List<PluginDirectory> pluginDirectories;
    private boolean closed;
    private final List<LoadFailure> scanFailures = new ArrayList<>();
    // latest discover-stage failures per namespace, replaced on every listing
    private final Map<String, List<LoadFailure>> discoverFailures = new LinkedHashMap<>();

    public DirectoryEntryPointSource(List<Path> pluginRoots, ClassLoader parent) {
        this(pluginRoots, parent, null);
    }

    public DirectoryEntryPointSource(List<Path> pluginRoots, ClassLoader parent, ClassLoadingPolicy policy) {
        this.pluginRoots = new ArrayList<>(Objects.requireNonNull(pluginRoots, "pluginRoots"));
        this.parent = Objects.requireNonNull(parent, "parent");
        this.policy = policy != null ? policy : ClassLoadingPolicy.defaultPolicy();
    }

    @Override
    public List<EntryPoint> listEntryPoints(String namespace) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace is empty");
        String resourceName = EntryPointRegistryReader.resourceName(namespace);
        List<EntryPoint> entryPoints = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>();
        for (PluginDirectory directory : getPluginDirectories()) {
            try {
                entryPoints.addAll(EntryPointRegistryReader.readAll(
                        directory.getClassLoader().findOwnResources(resourceName),
                        namespace,
                        directory.getClassLoader()));
            } catch (IOException e) {
                LoadFailure failure = new LoadFailure(
                        directory.getPluginDir(),
                        LoadFailure.STAGE_DISCOVER,
                        "Failed to read " + resourceName + " in " + directory.getPluginDir(),
                        e);
                logFailure(failure);
                failures.add(failure);
            }
        }
        synchronized (lifecycleLock) {
            if (failures.isEmpty()) {
                discoverFailures.remove(namespace);
            } else {
                discoverFailures.put(namespace, failures);
            }
        }
        return entryPoints;
    }

    /**
     * Returns the successfully scanned plugin directories, scanning on first call.
     *
     * @return plugin directories in visiting order
     * @throws IllegalStateException if this source has been closed
     */
    public List<PluginDirectory> getPluginDirectories() {
        synchronized (lifecycleLock) {
            Preconditions.checkState(!closed, "DirectoryEntryPointSource is closed");
            if (pluginDirectories == null) {
                pluginDirectories = ImmutableList.copyOf(scan());
            }
            return pluginDirectories;
        }
    }

    /**
     * Returns scan failures followed by the discover failures of the latest listing
     * of each namespace.
     *
     * @return recorded failures
     */
    public List<LoadFailure> getFailures() {
        synchronized (lifecycleLock) {
            ImmutableList.Builder<LoadFailure> all = ImmutableList.<LoadFailure>builder().addAll(scanFailures);
            discoverFailures.values().forEach(all::addAll);
            return all.build();
        }
    }

    @Override
    public void close() throws IOException {
        IOException first = null;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (pluginDirectories == null) {
                return;
            }
            for (PluginDirectory directory : pluginDirectories) {
                try {
                    directory.getClassLoader().close();
                } catch (IOException e) {
                    if (first == null) {
                        first = e;
                    } else {
                        first.addSuppressed(e);
                    }
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private List<PluginDirectory> scan() {
        List<Path> dirs = new ArrayList<>();
        for (Path root : pluginRoots) {
            if (root != null) {
                collectPluginDirs(root, dirs);
            }
        }
        List<PluginDirectory> scanned = new ArrayList<>();
        for (Path dir : dirs) {
            try {
                scanned.add(openPluginDir(dir));
            } catch (PluginDirectoryException e) {
                recordFailure(e.toLoadFailure());
            }
        }
        return scanned;
    }

    private void collectPluginDirs(Path root, List<Path> pluginDirs) {
        Path normalized = normalize(root);
        if (!Files.isDirectory(normalized)) {
            recordFailure(new LoadFailure(
                    normalized,
                    LoadFailure.STAGE_SCAN,
                    "Plugin root is missing or not a directory: " + normalized,
                    null));
            return;
        }
        try (Stream<Path> stream = Files.list(normalized)) {
            pluginDirs.addAll(stream.filter(Files::isDirectory)
                    .map(this::normalize)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            recordFailure(new LoadFailure(
                    normalized,
                    LoadFailure.STAGE_SCAN,
                    "Failed to list plugin root: " + normalized,
                    e));
        }
    }

    private PluginDirectory openPluginDir(Path pluginDir) throws PluginDirectoryException {
        List<Path> jars = resolveJars(pluginDir);
        URL[] urls = toUrls(jars, pluginDir);
        ChildFirstClassLoader classLoader;
        try {
            classLoader = policy.createClassLoader(urls, parent);
        } catch (RuntimeException e) {
            throw new PluginDirectoryException(
                    pluginDir,
                    LoadFailure.STAGE_CREATE_CLASSLOADER,
                    "Failed to create classloader for " + pluginDir,
                    e);
        }
        return new PluginDirectory(pluginDir, jars, classLoader);
    }

    private List<Path> resolveJars(Path pluginDir) throws PluginDirectoryException {
        List<Path> jars = new ArrayList<>();
        collectJars(pluginDir, jars);
        Path libDir = pluginDir.resolve("lib");
        if (Files.isDirectory(libDir)) {
            collectJars(libDir, jars);
        }
        if (jars.isEmpty()) {
            throw new PluginDirectoryException(
                    pluginDir,
                    LoadFailure.STAGE_RESOLVE,
                    "No jar found under plugin directory: " + pluginDir,
                    null);
        }
        return jars;
    }

    private void collectJars(Path directory, List<Path> target) throws PluginDirectoryException {
        try (Stream<Path> stream = Files.list(directory)) {
            target.addAll(stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .map(this::normalize)
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new PluginDirectoryException(
                    directory,
                    LoadFailure.STAGE_RESOLVE,
                    "Failed to resolve jars under " + directory,
                    e);
        }
    }

    private URL[] toUrls(List<Path> jars, Path pluginDir) throws PluginDirectoryException {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < jars.size(); i++) {
            try {
                urls[i] = jars.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new PluginDirectoryException(
                        pluginDir,
                        LoadFailure.STAGE_RESOLVE,
                        "Invalid jar path: " + jars.get(i),
                        e);
            }
        }
        return urls;
    }

    private void recordFailure(LoadFailure failure) {
        logFailure(failure);
        synchronized (lifecycleLock) {
            scanFailures.add(failure);
        }
    }

    private static void logFailure(LoadFailure failure) {
        LOG.warn("Skip plugin directory due to discovery failure: pluginDir={}, stage={}, message={}",
                failure.getPluginDir(), failure.getStage(), failure.getMessage(), failure.getCause());
    }

    private Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static final class PluginDirectoryException extends Exception {

        private final Path pluginDir;
        private final String stage;

        private PluginDirectoryException(Path pluginDir, String stage, String message, Throwable cause) {
            super(message, cause);
            this.pluginDir = pluginDir;
            this.stage = stage;
        }

        private LoadFailure toLoadFailure() {
            return new LoadFailure(pluginDir, stage, getMessage(), getCause());
        }
    }
}
