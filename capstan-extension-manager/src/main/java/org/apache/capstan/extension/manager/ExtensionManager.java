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
import org.apache.capstan.extension.Extension;
import org.apache.capstan.extension.ExtensionException;
import org.apache.capstan.extension.InvocationArguments;
import org.apache.capstan.extension.NoSuchExtensionException;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Loads every extension registered under a namespace and operates on the loaded set.
 *
 * <h2>Loading</h2>
 *
 * <p>All discovery and loading happens in the constructor:
 * <ol>
 *   <li>The configured {@link org.apache.capstan.extension.EntryPointSource} lists
 *       the entry points of the namespace. A failure here fails construction.</li>
 *   <li>Each entry point is resolved and, with invoke-on-load, invoked through the
 *       configured {@link PluginInvoker}.</li>
 *   <li>A failure while loading one entry is logged, reported to the optional
 *       {@link LoadFailureCallback}, and the entry is skipped. Other entries
 *       still load.</li>
 *   <li>Each loaded extension is offered to the post-load filter supplied by a
 *       subclass; rejected extensions are dropped. Exceptions thrown by the filter
 *       fail construction.</li>
 * </ol>
 *
 * <p>Survivors are kept in discovery order. The set never changes afterwards, so
 * a manager may be read from several threads once constructed.
 *
 * <h2>Map</h2>
 *
 * <p>{@link #map(ExtensionFunction)} calls a function on every extension. With
 * {@code propagateMapExceptions} the first failure is thrown to the caller and the
 * remaining extensions are not visited; without it the failure is logged and only
 * that extension's result is left out.
 *
 * <h2>Duplicate names</h2>
 *
 * <p>Entries with the same name are all kept, in discovery order. Lookups by name
 * return the first one.
 */
public class ExtensionManager implements Iterable<Extension> {
    private static final Logger LOG = LogManager.getLogger(ExtensionManager.class);

    /** Namespace given to managers built by {@link #makeTestInstance(List)}. */
    public static final String TEST_NAMESPACE = "TESTING";

    private static final Predicate<Extension> ACCEPT_ALL = extension -> true;

    private final String namespace;
    private final List<Extension> extensions;
    private final boolean propagateMapExceptions;

    /**
     * Discovers and loads the extensions described by the config.
     *
     * @param config manager settings
     * @throws ExtensionException if discovery of the namespace fails
     */
    public ExtensionManager(ExtensionManagerConfig config) {
        this(config, ACCEPT_ALL);
    }

    /**
     * Discovers and loads extensions, keeping only those accepted by {@code postLoadFilter}.
     *
     * @param config manager settings
     * @param postLoadFilter decides whether a loaded extension is kept
     */
    protected ExtensionManager(ExtensionManagerConfig config, Predicate<Extension> postLoadFilter) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(postLoadFilter, "postLoadFilter");
        this.namespace = config.getNamespace();
        this.propagateMapExceptions = config.isPropagateMapExceptions();
        this.extensions = loadExtensions(config, postLoadFilter);
    }

    /**
     * Wraps an already built list of extensions without any discovery.
     *
     * @param namespace namespace reported by the manager
     * @param extensions extensions in the order they should be kept
     * @param propagateMapExceptions map exception policy
     */
    protected ExtensionManager(String namespace, List<Extension> extensions, boolean propagateMapExceptions) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace is empty");
        this.namespace = namespace;
        this.extensions = ImmutableList.copyOf(Objects.requireNonNull(extensions, "extensions"));
        this.propagateMapExceptions = propagateMapExceptions;
    }

    /**
     * Builds a manager around pre-built extensions, for tests of code that consumes a manager.
     *
     * @param extensions extensions to manage
     * @return manager in the {@link #TEST_NAMESPACE} namespace that logs map failures
     */
    public static ExtensionManager makeTestInstance(List<Extension> extensions) {
        return makeTestInstance(extensions, TEST_NAMESPACE, false);
    }

    public static ExtensionManager makeTestInstance(List<Extension> extensions, String namespace,
            boolean propagateMapExceptions) {
        return new ExtensionManager(namespace, extensions, propagateMapExceptions);
    }

    private static List<Extension> loadExtensions(ExtensionManagerConfig config,
            Predicate<Extension> postLoadFilter) {
        String namespace = config.getNamespace();
        List<EntryPoint> entryPoints = config.getEntryPointSource().listEntryPoints(namespace);
        if (entryPoints.isEmpty() && config.isWarnOnMissingEntrypoint()) {
            LOG.warn("Could not load any extension: no entry points registered for namespace={}", namespace);
        }

        ImmutableList.Builder<Extension> loaded = ImmutableList.builder();
        for (EntryPoint entryPoint : entryPoints) {
            Optional<Extension> extension = loadOne(config, entryPoint);
            if (extension.isPresent() && postLoadFilter.test(extension.get())) {
                loaded.add(extension.get());
            }
        }
        return loaded.build();
    }

    private static Optional<Extension> loadOne(ExtensionManagerConfig config, EntryPoint entryPoint) {
        try {
            Object plugin = entryPoint.resolve();
            Object obj = null;
            if (config.isInvokeOnLoad()) {
                obj = config.getPluginInvoker().invoke(plugin, config.getInvokeArguments());
                if (obj == null) {
                    throw new ExtensionException("Invoking extension " + entryPoint.getName() + " returned null");
                }
            }
            return Optional.of(new Extension(entryPoint.getName(), entryPoint, plugin, obj));
        } catch (Exception e) {
            onLoadFailure(config, entryPoint, e);
        } catch (LinkageError e) {
            // a plugin class whose dependencies are missing fails on first use, not on resolve
            onLoadFailure(config, entryPoint,
                    new ExtensionException("Failed to load extension " + entryPoint.getName(), e));
        }
        return Optional.empty();
    }

    private static void onLoadFailure(ExtensionManagerConfig config, EntryPoint entryPoint, Exception e) {
        LOG.warn("Skip extension due to load failure: namespace={}, name={}, target={}",
                config.getNamespace(), entryPoint.getName(), entryPoint.getTarget(), e);
        Optional<LoadFailureCallback> callback = config.getOnLoadFailureCallback();
        if (callback.isPresent()) {
            callback.get().onLoadFailure(config.getNamespace(), entryPoint, e);
        }
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isPropagateMapExceptions() {
        return propagateMapExceptions;
    }

    /**
     * Returns the managed extensions in discovery order.
     *
     * @return immutable list of extensions
     */
    public List<Extension> extensions() {
        return extensions;
    }

    @Override
    public Iterator<Extension> iterator() {
        return extensions.iterator();
    }

    public int size() {
        return extensions.size();
    }

    public boolean isEmpty() {
        return extensions.isEmpty();
    }

    /**
     * Returns the names of the managed extensions in discovery order.
     *
     * @return extension names
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(extensions.size());
        for (Extension extension : extensions) {
            names.add(extension.getName());
        }
        return names;
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * Looks up an extension by name.
     *
     * @param name extension name
     * @return the first extension with that name, or empty
     */
    public Optional<Extension> find(String name) {
        for (Extension extension : extensions) {
            if (extension.getName().equals(name)) {
                return Optional.of(extension);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the extension with the given name.
     *
     * @param name extension name
     * @return the extension
     * @throws NoSuchExtensionException if no managed extension has that name
     */
    public Extension getExtension(String name) {
        return find(name).orElseThrow(() -> new NoSuchExtensionException(namespace, name));
    }

    /**
     * Returns the invocation result of the named extension.
     *
     * @param name extension name
     * @param type expected result type
     * @param <T> expected result type
     * @return the invocation result
     * @throws NoSuchExtensionException if no managed extension has that name
     * @throws ExtensionException if the extension was not invoked or has another type
     */
    public <T> T getObj(String name, Class<T> type) {
        return getExtension(name).getObj(type);
    }

    /**
     * Applies {@code func} to every extension and collects the results in order.
     *
     * @param func function to apply
     * @param <R> result type
     * @return results of the successful calls, empty when there are no extensions
     */
    public <R> List<R> map(ExtensionFunction<R> func) {
        return map(func, InvocationArguments.empty());
    }

    /**
     * Applies {@code func} with the given arguments to every extension and collects the results.
     *
     * <p>With {@code propagateMapExceptions} the first failure aborts the call:
     * unchecked exceptions are rethrown unchanged and checked ones are wrapped in an
     * {@link ExtensionException}. Otherwise failures are logged and skipped.
     *
     * @param func function to apply
     * @param arguments arguments handed to every call
     * @param <R> result type
     * @return results of the successful calls, in extension order
     */
    public <R> List<R> map(ExtensionFunction<R> func, InvocationArguments arguments) {
        Objects.requireNonNull(func, "func");
        InvocationArguments effective = arguments != null ? arguments : InvocationArguments.empty();
        List<R> results = new ArrayList<>(extensions.size());
        for (Extension extension : extensions) {
            R result;
            try {
                result = func.apply(extension, effective);
            } catch (Exception e) {
                handleMapFailure(extension, e);
                continue;
            }
            results.add(result);
        }
        return results;
    }

    /**
     * Calls a public instance method on every extension's invocation result.
     *
     * <p>The same exception policy as {@link #map(ExtensionFunction)} applies; an
     * extension that was not invoked on load, or whose result has no matching
     * method, counts as a failure for that extension.
     *
     * @param methodName method to call
     * @param args positional method arguments; a null array is one null argument
     * @return method return values in extension order
     */
    public List<Object> mapMethod(String methodName, Object... args) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(methodName), "methodName is empty");
        // mapMethod("m", null) passes a null array, read as one null argument
        List<Object> methodArgs = args != null ? Arrays.asList(args) : Collections.singletonList(null);
        return map((extension, ignored) -> callMethod(extension, methodName, methodArgs));
    }

    private static Object callMethod(Extension extension, String methodName, List<Object> args) throws Exception {
        Object target = extension.getObj().orElseThrow(() -> new ExtensionException(
                "Extension " + extension.getName() + " was not invoked on load, cannot call " + methodName));
        Method method = Reflections.findMethod(target.getClass(), methodName, args)
                .orElseThrow(() -> new ExtensionException("No public method " + methodName + " taking "
                        + args.size() + " argument(s) on " + target.getClass().getName()));
        return Reflections.invoke(method, target, args.toArray());
    }

    private void handleMapFailure(Extension extension, Exception e) {
        if (propagateMapExceptions) {
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new ExtensionException("Error calling extension " + extension.getName(), e);
        }
        LOG.error("Error calling extension: namespace={}, name={}", namespace, extension.getName(), e);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{"
                + "namespace='" + namespace + '\''
                + ", extensions=" + names()
                + '}';
    }
}
