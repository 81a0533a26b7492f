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
import org.apache.capstan.extension.ExtensionException;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.Objects;

/**
 * Entry point whose target names a class, or a public static field of a class.
 *
 * <p>Target syntax:
 * <ul>
 *   <li>{@code com.example.Foo} resolves to the {@code Class} object</li>
 *   <li>{@code com.example.Foo#INSTANCE} resolves to the value of that static field</li>
 * </ul>
 */
public final class ClassEntryPoint implements EntryPoint {

    public static final char MEMBER_SEPARATOR = '#';

    private final String name;
    private final String namespace;
    private final String target;
    private final ClassLoader classLoader;
    private final URL origin;

    public ClassEntryPoint(String name, String namespace, String target, ClassLoader classLoader, URL origin) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "name is empty");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(target), "target is empty");
        this.name = name;
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.target = target;
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.origin = origin;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    @Override
    public String getTarget() {
        return target;
    }

    /**
     * Returns the registry resource this entry point was read from.
     *
     * @return resource URL, or null when built programmatically
     */
    public URL getOrigin() {
        return origin;
    }

    @Override
    public Object resolve() throws ExtensionException {
        int separator = target.indexOf(MEMBER_SEPARATOR);
        String className = separator >= 0 ? target.substring(0, separator) : target;
        Class<?> clazz;
        try {
            clazz = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ExtensionException("Failed to load class " + className + " for extension " + name, e);
        }
        if (separator < 0) {
            return clazz;
        }
        return readStaticField(clazz, target.substring(separator + 1));
    }

    private Object readStaticField(Class<?> clazz, String fieldName) {
        Field field;
        try {
            field = clazz.getField(fieldName);
        } catch (NoSuchFieldException e) {
            throw new ExtensionException("No public field " + fieldName + " on " + clazz.getName()
                    + " for extension " + name, e);
        }
        if (!Modifier.isStatic(field.getModifiers())) {
            throw new ExtensionException("Field " + fieldName + " on " + clazz.getName() + " is not static");
        }
        Object value;
        try {
            value = field.get(null);
        } catch (IllegalAccessException e) {
            throw new ExtensionException("Cannot read field " + fieldName + " on " + clazz.getName(), e);
        }
        if (value == null) {
            throw new ExtensionException("Field " + fieldName + " on " + clazz.getName() + " is null");
        }
        return value;
    }

    @Override
    public String toString() {
        return namespace + ":" + name + " = " + target;
    }
}
