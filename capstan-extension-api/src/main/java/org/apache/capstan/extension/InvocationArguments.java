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

package org.apache.capstan.extension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Positional and named arguments forwarded to a plugin when it is invoked.
 *
 * <p>Instances are immutable. Positional values may be null; named values keep
 * insertion order.
 */
public final class InvocationArguments {

    private static final InvocationArguments EMPTY =
            new InvocationArguments(Collections.emptyList(), Collections.emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private InvocationArguments(List<Object> positional, Map<String, Object> named) {
        this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
        this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    public static InvocationArguments empty() {
        return EMPTY;
    }

    /**
     * Creates arguments with positional values only.
     *
     * @param args positional values
     * @return arguments
     */
    public static InvocationArguments of(Object... args) {
        if (args == null || args.length == 0) {
            return EMPTY;
        }
        return new InvocationArguments(Arrays.asList(args), Collections.emptyMap());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Object> getPositional() {
        return positional;
    }

    public Map<String, Object> getNamed() {
        return named;
    }

    public Optional<Object> getNamed(String key) {
        return Optional.ofNullable(named.get(key));
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }

    public boolean hasNamed() {
        return !named.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InvocationArguments that = (InvocationArguments) o;
        return positional.equals(that.positional) && named.equals(that.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return "InvocationArguments{"
                + "positional=" + positional.size()
                + ", named=" + named.keySet()
                + '}';
    }

    /**
     * Builder for {@link InvocationArguments}.
     */
    public static final class Builder {
        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> named = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder arg(Object value) {
            positional.add(value);
            return this;
        }

        public Builder args(Object... values) {
            if (values != null) {
                positional.addAll(Arrays.asList(values));
            }
            return this;
        }

        public Builder named(String key, Object value) {
            Objects.requireNonNull(key, "key");
            named.put(key, value);
            return this;
        }

        public InvocationArguments build() {
            if (positional.isEmpty() && named.isEmpty()) {
                return EMPTY;
            }
            return new InvocationArguments(positional, named);
        }
    }
}
