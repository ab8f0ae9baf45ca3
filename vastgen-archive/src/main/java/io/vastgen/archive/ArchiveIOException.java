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

import java.io.IOException;

/**
 * An archive could not be written. The target path is left as it was before the attempt.
 */
public class ArchiveIOException extends IOException {

    private final ObjectRef object;

    public ArchiveIOException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ArchiveIOException(String message, ObjectRef object, Throwable cause) {
        super(message, cause);
        this.object = object;
    }

    /// @return the object being archived when the failure happened, or null
    public ObjectRef getObject() {
        return object;
    }
}
