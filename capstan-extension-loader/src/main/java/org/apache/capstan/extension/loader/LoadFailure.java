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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.nio.file.Path;

/**
 * Failure record for one plugin directory that could not contribute entry points.
 */
public final class LoadFailure {

    public static final String STAGE_SCAN = "scan";
    public static final String STAGE_RESOLVE = "resolve";
    public static final String STAGE_CREATE_CLASSLOADER = "createClassLoader";
    public static final String STAGE_DISCOVER = "discover";

    private final Path pluginDir;
    private final String stage;
    private final String message;
    private final Throwable cause;

    public LoadFailure(Path pluginDir, String stage, String message, Throwable cause) {
        this.pluginDir = pluginDir;
        this.stage = requireNonBlank(stage, "stage");
        this.message = requireNonBlank(message, "message");
        this.cause = cause;
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    public String getStage() {
        return stage;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "LoadFailure{"
                + "pluginDir=" + pluginDir
                + ", stage='" + stage + '\''
                + ", message='" + message + '\''
                + '}';
    }

    private static String requireNonBlank(String value, String fieldName) {
        String trimmed = Strings.nullToEmpty(value).trim();
        Preconditions.checkArgument(!trimmed.isEmpty(), "%s is blank", fieldName);
        return trimmed;
    }
}
