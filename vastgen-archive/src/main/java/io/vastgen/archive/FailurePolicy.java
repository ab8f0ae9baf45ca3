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


package io.vastgen.archive;

/// What to do when a referenced object cannot be opened while archiving.
public enum FailurePolicy {
    /// abort the archive; nothing is written at the target path
    FAIL_FAST,
    /// leave the object out, record it in [ArchiveResult#getSkipped()], and go on
    SKIP_UNREADABLE
}
