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

/**
 * Discovery-time handle for one registered extension.
 *
 * <p>An entry point only names its target. Nothing is loaded until
 * {@link #resolve()} is called.
 */
public interface EntryPoint {

    /**
     * Returns the extension name, unique within its namespace in normal operation.
     *
     * @return extension name
     */
    String getName();

    /**
     * Returns the namespace this entry point was registered under.
     *
     * @return namespace
     */
    String getNamespace();

    /**
     * Returns a textual reference to the loadable object, such as a class name.
     *
     * @return target reference
     */
    String getTarget();

    /**
     * Loads the object this entry point refers to.
     *
     * @return the plugin object, never null
     * @throws ExtensionException if the target cannot be loaded
     */
    Object resolve() throws ExtensionException;
}
