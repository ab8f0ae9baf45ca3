/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


/// Dispatch of variants as isolated cluster jobs.
///
/// [ClusterJobDispatcher] owns the retry and concurrency policy and talks to a scheduler
/// only through the [ClusterClient] capability. A run's outcome is a [RunReport].
package io.vastgen.dispatch;
