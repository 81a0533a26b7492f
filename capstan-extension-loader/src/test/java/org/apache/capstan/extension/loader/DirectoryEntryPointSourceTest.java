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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.stream.Collectors;

/**
 * Unit tests for {@link DirectoryEntryPointSource}.
 */
@DisplayName("DirectoryEntryPointSource Unit Tests")
class DirectoryEntryPointSourceTest {

    private static final String NAMESPACE = "capstan.test.directory";

    private DirectoryEntryPointSource source;

    @AfterEach
    void tearDown() throws IOException {
        if (source != null) {
            source.close();
        }
    }

    @Test
    @DisplayName("UT-LOADER-DIR-001: Entries from plugin directories are listed in directory name order")
    void testDirectoryOrder() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root");
        createRegistryOnlyJar(root.resolve("b-plugin").resolve("b-plugin.jar"), NAMESPACE,
                "second = " + LoaderTestPlugins.Second.class.getName());
        createRegistryOnlyJar(root.resolve("a-plugin").resolve("lib").resolve("a-lib.jar"), NAMESPACE,
                "first = " + LoaderTestPlugins.First.class.getName());
        source = new DirectoryEntryPointSource(Collections.singletonList(root), getClass().getClassLoader());

        // When
        List<EntryPoint> entryPoints = source.listEntryPoints(NAMESPACE);

        // Then
        Assertions.assertEquals(Arrays.asList("first", "second"), names(entryPoints));
        Assertions.assertEquals(2, source.getPluginDirectories().size());
        Assertions.assertEquals("a-plugin", source.getPluginDirectories().get(0).getDirectoryName());
        Assertions.assertTrue(source.getFailures().isEmpty());
    }

    @Test
    @DisplayName("UT-LOADER-DIR-002: Entry points resolve through the plugin class loader")
    void testResolveThroughPluginClassLoader() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-resolve");
        createRegistryOnlyJar(root.resolve("only").resolve("only.jar"), NAMESPACE,
                "first = " + LoaderTestPlugins.First.class.getName());
        source = new DirectoryEntryPointSource(Collections.singletonList(root), getClass().getClassLoader());

        // When
        EntryPoint entryPoint = source.listEntryPoints(NAMESPACE).get(0);

        // Then - the API package is parent-first, so the host's class is returned
        Assertions.assertSame(LoaderTestPlugins.First.class, entryPoint.resolve());
        Assertions.assertInstanceOf(ClassEntryPoint.class, entryPoint);
        Assertions.assertTrue(((ClassEntryPoint) entryPoint).getOrigin().toString().contains("only.jar"));
    }

    @Test
    @DisplayName("UT-LOADER-DIR-003: Registries on the parent class path are not visible")
    void testParentRegistryHidden() throws Exception {
        // Given - capstan.test.loader exists on the test class path only
        Path root = Files.createTempDirectory("plugin-root-hidden");
        createRegistryOnlyJar(root.resolve("plugin").resolve("plugin.jar"), NAMESPACE,
                "first = " + LoaderTestPlugins.First.class.getName());
        source = new DirectoryEntryPointSource(Collections.singletonList(root), getClass().getClassLoader());

        // When & Then
        Assertions.assertTrue(source.listEntryPoints("capstan.test.loader").isEmpty());
    }

    @Test
    @DisplayName("UT-LOADER-DIR-004: A broken directory is recorded and the others still load")
    void testBrokenDirectoryIsolated() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-broken");
        Files.createDirectories(root.resolve("empty-plugin"));
        createRegistryOnlyJar(root.resolve("good-plugin").resolve("good.jar"), NAMESPACE,
                "second = " + LoaderTestPlugins.Second.class.getName());
        Path missingRoot = root.resolve("does-not-exist");
        source = new DirectoryEntryPointSource(Arrays.asList(root, missingRoot), getClass().getClassLoader());

        // When
        List<EntryPoint> entryPoints = source.listEntryPoints(NAMESPACE);

        // Then
        Assertions.assertEquals(Collections.singletonList("second"), names(entryPoints));
        List<LoadFailure> failures = source.getFailures();
        Assertions.assertEquals(2, failures.size());
        Assertions.assertEquals(LoadFailure.STAGE_SCAN, failures.get(0).getStage());
        Assertions.assertEquals(LoadFailure.STAGE_RESOLVE, failures.get(1).getStage());
        Assertions.assertTrue(failures.get(1).getPluginDir().endsWith("empty-plugin"));
    }

    @Test
    @DisplayName("UT-LOADER-DIR-005: Directories are scanned once across namespaces")
    void testScannedOnce() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-once");
        createRegistryOnlyJar(root.resolve("plugin").resolve("plugin.jar"), NAMESPACE,
                "first = " + LoaderTestPlugins.First.class.getName());
        source = new DirectoryEntryPointSource(Collections.singletonList(root), getClass().getClassLoader());

        // When
        List<PluginDirectory> firstScan = source.getPluginDirectories();
        source.listEntryPoints("capstan.test.other");
        List<PluginDirectory> secondScan = source.getPluginDirectories();

        // Then
        Assertions.assertSame(firstScan, secondScan);
        Assertions.assertEquals(1, firstScan.get(0).getResolvedJars().size());
    }

    @Test
    @DisplayName("UT-LOADER-DIR-006: Closing before any scan is a no-op")
    void testCloseBeforeScan() {
        DirectoryEntryPointSource unused = new DirectoryEntryPointSource(
                Collections.<Path>emptyList(), getClass().getClassLoader());
        Assertions.assertDoesNotThrow(unused::close);
    }

    @Test
    @DisplayName("UT-LOADER-DIR-007: Repeated listing keeps only the latest discover failures per namespace")
    void testDiscoverFailuresNotAccumulated() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-discover");
        createRegistryOnlyJar(root.resolve("plugin").resolve("plugin.jar"), NAMESPACE,
                "first = " + LoaderTestPlugins.First.class.getName());
        ChildFirstClassLoader unreadable = Mockito.mock(ChildFirstClassLoader.class);
        Mockito.when(unreadable.findOwnResources(Mockito.anyString())).thenThrow(new IOException("zip closed"));
        ClassLoadingPolicy policy = Mockito.mock(ClassLoadingPolicy.class);
        Mockito.when(policy.createClassLoader(Mockito.any(), Mockito.any())).thenReturn(unreadable);
        source = new DirectoryEntryPointSource(Collections.singletonList(root), getClass().getClassLoader(), policy);

        // When
        source.listEntryPoints(NAMESPACE);
        source.listEntryPoints(NAMESPACE);

        // Then
        List<LoadFailure> failures = source.getFailures();
        Assertions.assertEquals(1, failures.size());
        Assertions.assertEquals(LoadFailure.STAGE_DISCOVER, failures.get(0).getStage());

        // When - another namespace fails on its own
        source.listEntryPoints("capstan.test.other");

        // Then
        Assertions.assertEquals(2, source.getFailures().size());
    }

    @Test
    @DisplayName("UT-LOADER-DIR-008: A closed source rejects further use")
    void testClosedSourceRejectsListing() throws Exception {
        // Given
        Path root = Files.createTempDirectory("plugin-root-closed");
        createRegistryOnlyJar(root.resolve("plugin").resolve("plugin.jar"), NAMESPACE,
                "first = " + LoaderTestPlugins.First.class.getName());
        DirectoryEntryPointSource closing = new DirectoryEntryPointSource(
                Collections.singletonList(root), getClass().getClassLoader());
        Assertions.assertEquals(1, closing.listEntryPoints(NAMESPACE).size());

        // When
        closing.close();

        // Then
        Assertions.assertThrows(IllegalStateException.class, () -> closing.listEntryPoints(NAMESPACE));
        Assertions.assertThrows(IllegalStateException.class, closing::getPluginDirectories);
        Assertions.assertDoesNotThrow(closing::close);
    }

    private static List<String> names(List<EntryPoint> entryPoints) {
        return entryPoints.stream().map(EntryPoint::getName).collect(Collectors.toList());
    }

    private static void createRegistryOnlyJar(Path jarPath, String namespace, String... lines) throws IOException {
        Files.createDirectories(jarPath.getParent());
        try (JarOutputStream jar = new JarOutputStream(Files.newOutputStream(jarPath))) {
            jar.putNextEntry(new JarEntry(EntryPointRegistryReader.resourceName(namespace)));
            for (String line : lines) {
                jar.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            }
            jar.closeEntry();
        }
    }
}
