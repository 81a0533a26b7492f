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

import org.apache.capstan.extension.EntryPoint;
import org.apache.capstan.extension.EntryPointSource;
import org.apache.capstan.extension.Extension;
import org.apache.capstan.extension.ExtensionException;
import org.apache.capstan.extension.InvocationArguments;
import org.apache.capstan.extension.NoSuchExtensionException;
import org.apache.capstan.extension.loader.ClasspathEntryPointSource;
import org.apache.capstan.extension.loader.StaticEntryPointSource;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Unit tests for {@link ExtensionManager}.
 */
@DisplayName("ExtensionManager Unit Tests")
class ExtensionManagerTest {

    static final String GREETERS = "capstan.test.greeters";

    private static ExtensionManagerConfig.Builder classpathConfig() {
        return ExtensionManagerConfig.builder(GREETERS)
                .entryPointSource(new ClasspathEntryPointSource(ExtensionManagerTest.class.getClassLoader()));
    }

    static Extension extension(String name) {
        return new Extension(name, null, TestPlugins.Fixed.class, new TestPlugins.Fixed(name));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("UT-MGR-EM-001: Extensions are kept in registry order, unresolvable entries skipped")
        void testDiscoveryOrder() {
            // When
            ExtensionManager manager = new ExtensionManager(classpathConfig().build());

            // Then
            Assertions.assertEquals(GREETERS, manager.getNamespace());
            Assertions.assertEquals(Arrays.asList("alpha", "beta", "broken", "gamma", "factory"), manager.names());
            Assertions.assertSame(TestPlugins.Alpha.class, manager.getExtension("alpha").getPlugin());
            Assertions.assertSame(TestPlugins.FACTORY, manager.getExtension("factory").getPlugin());
            Assertions.assertFalse(manager.getExtension("alpha").getObj().isPresent());
        }

        @Test
        @DisplayName("UT-MGR-EM-002: Invoke-on-load failure isolates only the failing extension")
        void testInvokeOnLoadFailureIsolation() {
            // When
            ExtensionManager manager = new ExtensionManager(classpathConfig().invokeOnLoad(true).build());

            // Then
            Assertions.assertEquals(Arrays.asList("alpha", "beta", "gamma", "factory"), manager.names());
            Assertions.assertInstanceOf(TestPlugins.Alpha.class, manager.getExtension("alpha").getObj().get());
            Assertions.assertEquals("hey you",
                    manager.getObj("factory", TestPlugins.Greeter.class).greet("you"));
        }

        @Test
        @DisplayName("UT-MGR-EM-003: Invoke arguments reach every plugin")
        void testInvokeArguments() {
            // Given
            StaticEntryPointSource source = StaticEntryPointSource.builder()
                    .register(GREETERS, "configurable", TestPlugins.Configurable.class)
                    .register(GREETERS, "factory", TestPlugins.FACTORY)
                    .build();
            InvocationArguments arguments = InvocationArguments.builder().named("greeting", "hello").build();

            // When
            ExtensionManager manager = new ExtensionManager(ExtensionManagerConfig.builder(GREETERS)
                    .entryPointSource(source)
                    .invokeOnLoad(true)
                    .invokeArguments(arguments)
                    .build());

            // Then
            Assertions.assertSame(arguments,
                    manager.getObj("configurable", TestPlugins.Configurable.class).getArguments());
            Assertions.assertEquals("hello world",
                    manager.getObj("factory", TestPlugins.Greeter.class).greet("world"));
        }

        @Test
        @DisplayName("UT-MGR-EM-004: Load failure callback sees every failed entry")
        void testLoadFailureCallback() {
            // Given
            LoadFailureCallback callback = Mockito.mock(LoadFailureCallback.class);

            // When
            ExtensionManager manager = new ExtensionManager(classpathConfig()
                    .invokeOnLoad(true)
                    .onLoadFailureCallback(callback)
                    .build());

            // Then
            ArgumentCaptor<EntryPoint> entryPoints = ArgumentCaptor.forClass(EntryPoint.class);
            ArgumentCaptor<Exception> causes = ArgumentCaptor.forClass(Exception.class);
            Mockito.verify(callback, Mockito.times(2))
                    .onLoadFailure(Mockito.eq(GREETERS), entryPoints.capture(), causes.capture());
            Assertions.assertEquals("broken", entryPoints.getAllValues().get(0).getName());
            Assertions.assertInstanceOf(IllegalStateException.class, causes.getAllValues().get(0));
            Assertions.assertEquals("missing", entryPoints.getAllValues().get(1).getName());
            Assertions.assertEquals(4, manager.size());
        }

        @Test
        @DisplayName("UT-MGR-EM-005: Throwing from the load failure callback aborts construction")
        void testStrictLoadFailureCallback() {
            // Given
            ExtensionManagerConfig config = classpathConfig()
                    .onLoadFailureCallback((namespace, entryPoint, cause) -> {
                        throw new ExtensionException("strict: " + entryPoint.getName(), cause);
                    })
                    .build();

            // When
            ExtensionException ex = Assertions.assertThrows(ExtensionException.class,
                    () -> new ExtensionManager(config));

            // Then
            Assertions.assertEquals("strict: missing", ex.getMessage());
        }

        @Test
        @DisplayName("UT-MGR-EM-006: Discovery failure fails construction")
        void testDiscoveryFailure() {
            // Given
            EntryPointSource source = Mockito.mock(EntryPointSource.class);
            Mockito.when(source.listEntryPoints(GREETERS))
                    .thenThrow(new ExtensionException("registry unavailable", new IOException("io")));

            // When & Then
            ExtensionException ex = Assertions.assertThrows(ExtensionException.class,
                    () -> new ExtensionManager(ExtensionManagerConfig.builder(GREETERS)
                            .entryPointSource(source)
                            .build()));
            Assertions.assertEquals("registry unavailable", ex.getMessage());
        }

        @Test
        @DisplayName("UT-MGR-EM-007: Invocation returning null counts as a load failure")
        void testNullInvocationResult() {
            // Given
            StaticEntryPointSource source = StaticEntryPointSource.builder()
                    .register(GREETERS, "nothing", (Supplier<Object>) () -> null)
                    .register(GREETERS, "alpha", TestPlugins.Alpha.class)
                    .build();

            // When
            ExtensionManager manager = new ExtensionManager(ExtensionManagerConfig.builder(GREETERS)
                    .entryPointSource(source)
                    .invokeOnLoad(true)
                    .build());

            // Then
            Assertions.assertEquals(Collections.singletonList("alpha"), manager.names());
        }

        @Test
        @DisplayName("UT-MGR-EM-009: Linkage error in a plugin constructor is a load failure")
        void testLinkageErrorIsolation() {
            // Given
            StaticEntryPointSource source = StaticEntryPointSource.builder()
                    .register(GREETERS, "a", TestPlugins.Alpha.class)
                    .register(GREETERS, "b", TestPlugins.Unlinked.class)
                    .register(GREETERS, "c", TestPlugins.Gamma.class)
                    .build();
            LoadFailureCallback callback = Mockito.mock(LoadFailureCallback.class);

            // When
            ExtensionManager manager = new ExtensionManager(ExtensionManagerConfig.builder(GREETERS)
                    .entryPointSource(source)
                    .invokeOnLoad(true)
                    .onLoadFailureCallback(callback)
                    .build());

            // Then
            Assertions.assertEquals(Arrays.asList("a", "c"), manager.names());
            ArgumentCaptor<Exception> causes = ArgumentCaptor.forClass(Exception.class);
            Mockito.verify(callback).onLoadFailure(Mockito.eq(GREETERS), Mockito.any(EntryPoint.class),
                    causes.capture());
            Assertions.assertInstanceOf(ExtensionException.class, causes.getValue());
            Assertions.assertInstanceOf(NoClassDefFoundError.class, causes.getValue().getCause());
        }

        @Test
        @DisplayName("UT-MGR-EM-008: Empty namespace logs a warning unless disabled")
        void testMissingNamespaceWarning() {
            try (CapturingAppender appender = CapturingAppender.attach(ExtensionManager.class)) {
                // When
                ExtensionManager warned = new ExtensionManager(
                        ExtensionManagerConfig.builder("capstan.test.empty")
                                .entryPointSource(StaticEntryPointSource.builder().build())
                                .build());
                new ExtensionManager(ExtensionManagerConfig.builder("capstan.test.quiet")
                        .entryPointSource(StaticEntryPointSource.builder().build())
                        .warnOnMissingEntrypoint(false)
                        .build());

                // Then
                Assertions.assertTrue(warned.isEmpty());
                List<String> warnings = appender.messages(Level.WARN);
                Assertions.assertEquals(1, warnings.size());
                Assertions.assertTrue(warnings.get(0).contains("capstan.test.empty"));
            }
        }
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("UT-MGR-EM-101: Lookup by name distinguishes found from not found")
        void testLookup() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Arrays.asList(extension("a"), extension("b")));

            // When & Then
            Assertions.assertTrue(manager.contains("b"));
            Assertions.assertFalse(manager.contains("z"));
            Assertions.assertFalse(manager.find("z").isPresent());
            NoSuchExtensionException ex = Assertions.assertThrows(NoSuchExtensionException.class,
                    () -> manager.getExtension("z"));
            Assertions.assertEquals(ExtensionManager.TEST_NAMESPACE, ex.getNamespace());
            Assertions.assertEquals("z", ex.getExtensionName());
        }

        @Test
        @DisplayName("UT-MGR-EM-102: With duplicate names the first in discovery order wins")
        void testDuplicateNames() {
            // Given
            Extension first = extension("dup");
            Extension second = extension("dup");
            ExtensionManager manager = ExtensionManager.makeTestInstance(Arrays.asList(first, second));

            // When & Then
            Assertions.assertEquals(2, manager.size());
            Assertions.assertSame(first, manager.getExtension("dup"));
        }

        @Test
        @DisplayName("UT-MGR-EM-103: Iteration is repeatable and read-only")
        void testIteration() {
            // Given
            List<Extension> source = new ArrayList<>(Arrays.asList(extension("a"), extension("b")));
            ExtensionManager manager = ExtensionManager.makeTestInstance(source);
            source.add(extension("late"));

            // When
            List<String> firstPass = new ArrayList<>();
            for (Extension extension : manager) {
                firstPass.add(extension.getName());
            }

            // Then
            Assertions.assertEquals(firstPass, manager.names());
            Assertions.assertEquals(Arrays.asList("a", "b"), firstPass);
            Iterator<Extension> iterator = manager.iterator();
            iterator.next();
            Assertions.assertThrows(UnsupportedOperationException.class, iterator::remove);
            Assertions.assertThrows(UnsupportedOperationException.class,
                    () -> manager.extensions().add(extension("x")));
        }
    }

    @Nested
    @DisplayName("Map")
    class Mapping {

        @Test
        @DisplayName("UT-MGR-EM-201: Best-effort map omits the failing result and logs it")
        void testBestEffortMap() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Arrays.asList(extension("a"), extension("b"), extension("c")));

            try (CapturingAppender appender = CapturingAppender.attach(ExtensionManager.class)) {
                // When
                List<String> results = manager.map((extension, args) -> {
                    if ("b".equals(extension.getName())) {
                        throw new IllegalStateException("b fails");
                    }
                    return extension.getName().toUpperCase();
                });

                // Then
                Assertions.assertEquals(Arrays.asList("A", "C"), results);
                List<String> errors = appender.messages(Level.ERROR);
                Assertions.assertEquals(1, errors.size());
                Assertions.assertTrue(errors.get(0).contains("name=b"));
            }
        }

        @Test
        @DisplayName("UT-MGR-EM-202: Fail-fast map stops at the first failure")
        void testFailFastMap() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Arrays.asList(extension("a"), extension("b"), extension("c")), "fail-fast", true);
            List<String> visited = new ArrayList<>();

            // When
            IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                    () -> manager.map((extension, args) -> {
                        visited.add(extension.getName());
                        if ("b".equals(extension.getName())) {
                            throw new IllegalStateException("b fails");
                        }
                        return extension.getName();
                    }));

            // Then
            Assertions.assertEquals("b fails", ex.getMessage());
            Assertions.assertEquals(Arrays.asList("a", "b"), visited);
            Assertions.assertTrue(manager.isPropagateMapExceptions());
        }

        @Test
        @DisplayName("UT-MGR-EM-203: Fail-fast map wraps checked exceptions")
        void testFailFastCheckedException() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Collections.singletonList(extension("a")), "fail-fast", true);

            // When
            ExtensionException ex = Assertions.assertThrows(ExtensionException.class,
                    () -> manager.map((extension, args) -> {
                        throw new IOException("checked");
                    }));

            // Then
            Assertions.assertInstanceOf(IOException.class, ex.getCause());
            Assertions.assertTrue(ex.getMessage().contains("a"));
        }

        @Test
        @DisplayName("UT-MGR-EM-204: Empty manager maps to an empty list")
        void testEmptyMap() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(Collections.emptyList());

            // When
            List<Object> results = manager.map((extension, args) -> {
                throw new AssertionError("must not be called");
            });

            // Then
            Assertions.assertTrue(results.isEmpty());
            Assertions.assertFalse(manager.iterator().hasNext());
            Assertions.assertTrue(manager.mapMethod("greet", "x").isEmpty());
        }

        @Test
        @DisplayName("UT-MGR-EM-205: Map forwards the call arguments")
        void testMapArguments() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Arrays.asList(extension("a"), extension("b")));
            InvocationArguments arguments = InvocationArguments.of("world");

            // When
            List<String> results = manager.map(
                    (extension, args) -> extension.getObj(TestPlugins.Greeter.class)
                            .greet((String) args.getPositional().get(0)),
                    arguments);

            // Then
            Assertions.assertEquals(Arrays.asList("a world", "b world"), results);
        }

        @Test
        @DisplayName("UT-MGR-EM-206: mapMethod calls a method on each invocation result")
        void testMapMethod() {
            // Given
            Extension notInvoked = new Extension("plain", null, TestPlugins.Alpha.class, null);
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Arrays.asList(extension("a"), notInvoked,
                            new Extension("r", null, TestPlugins.Repeating.class, new TestPlugins.Repeating("yo", 2))));

            // When
            List<Object> results = manager.mapMethod("greet", "bob");

            // Then
            Assertions.assertEquals(Arrays.asList("a bob", "yo yo bob"), results);
        }

        @Test
        @DisplayName("UT-MGR-EM-208: mapMethod with a null argument array passes one null argument")
        void testMapMethodNullArgument() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Collections.singletonList(extension("a")), "strict", true);

            // When
            List<Object> results = manager.mapMethod("greet", (Object[]) null);

            // Then
            Assertions.assertEquals(Collections.singletonList("a null"), results);
        }

        @Test
        @DisplayName("UT-MGR-EM-207: mapMethod with a missing method fails fast when propagating")
        void testMapMethodMissing() {
            // Given
            ExtensionManager manager = ExtensionManager.makeTestInstance(
                    Collections.singletonList(extension("a")), "strict", true);

            // When & Then
            ExtensionException ex = Assertions.assertThrows(ExtensionException.class,
                    () -> manager.mapMethod("wave"));
            Assertions.assertTrue(ex.getMessage().contains("wave"));
        }
    }
}
