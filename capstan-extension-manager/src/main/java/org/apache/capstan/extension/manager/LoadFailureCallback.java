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

/**
 * Notified when one entry point cannot be loaded while a manager is being built.
 *
 * <p>The failed entry is skipped either way. Throwing from the callback aborts
 * construction of the manager, which lets strict callers turn any load failure
 * into a hard error.
 */
@FunctionalInterface
public interface LoadFailureCallback {

    void onLoadFailure(String namespace, EntryPoint entryPoint, Exception cause);
}
