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
 * Entry point discovery for Capstan extension managers.
 *
 * <p>Three {@link org.apache.capstan.extension.EntryPointSource} implementations
 * are provided: {@link org.apache.capstan.extension.loader.ClasspathEntryPointSource}
 * reads {@code META-INF/capstan/extensions/<namespace>} registry resources from a
 * class loader, {@link org.apache.capstan.extension.loader.DirectoryEntryPointSource}
 * reads them from plugin directories loaded through child-first class loaders, and
 * {@link org.apache.capstan.extension.loader.StaticEntryPointSource} serves
 * programmatic registrations.
 *
 * <p>Discovery only names entries. Loading, invocation and filtering belong to the
 * extension managers.
 */
package org.apache.capstan.extension.loader;
