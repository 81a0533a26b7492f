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

/**
 * Extension managers.
 *
 * <p>{@link org.apache.capstan.extension.manager.ExtensionManager} loads every
 * extension of a namespace; {@link org.apache.capstan.extension.manager.EnabledExtensionManager}
 * additionally drops the extensions rejected by a check function. Both are configured
 * once through {@link org.apache.capstan.extension.manager.ExtensionManagerConfig}
 * and are read-only afterwards.
 *
 * <p>Out of scope: ordering extensions by their dependencies, isolating plugin code
 * from the host, and reloading or unloading extensions.
 */
package org.apache.capstan.extension.manager;
