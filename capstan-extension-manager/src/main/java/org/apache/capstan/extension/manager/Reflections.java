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

import com.google.common.primitives.Primitives;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Optional;

/**
 * Argument-matching helpers for reflective plugin calls.
 */
final class Reflections {

    private Reflections() {
    }

    static Optional<Constructor<?>> findConstructor(Class<?> type, List<Object> args) {
        for (Constructor<?> constructor : type.getConstructors()) {
            if (accepts(constructor.getParameterTypes(), args)) {
                return Optional.of(constructor);
            }
        }
        return Optional.empty();
    }

    static Optional<Method> findMethod(Class<?> type, String name, List<Object> args) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name) && !Modifier.isStatic(method.getModifiers())
                    && accepts(method.getParameterTypes(), args)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    static Object newInstance(Constructor<?> constructor, Object... args) throws Exception {
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw unwrap(e);
        }
    }

    static Object invoke(Method method, Object target, Object... args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw unwrap(e);
        }
    }

    private static boolean accepts(Class<?>[] parameterTypes, List<Object> args) {
        if (parameterTypes.length != args.size()) {
            return false;
        }
        for (int i = 0; i < parameterTypes.length; i++) {
            Object arg = args.get(i);
            if (arg == null) {
                if (parameterTypes[i].isPrimitive()) {
                    return false;
                }
                continue;
            }
            if (!Primitives.wrap(parameterTypes[i]).isInstance(arg)) {
                return false;
            }
        }
        return true;
    }

    private static Exception unwrap(InvocationTargetException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return cause instanceof Exception ? (Exception) cause : e;
    }
}
