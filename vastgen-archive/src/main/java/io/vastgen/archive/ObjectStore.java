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
import java.io.InputStream;
import java.util.List;

/**
 * Read access to the object storage jobs write their results into.
 *
 * @see S3ObjectStore
 * @see LocalObjectStore
 */
public interface ObjectStore {

    /**
     * @param prefix a key prefix, typically {@code <run id>/<variant id>/}
     * @return every object whose key starts with the prefix, ordered by key
     * @throws IOException if the store could not be listed
     */
    List<ObjectRef> list(String prefix) throws IOException;

    /**
     * @param ref an object from {@link #list}
     * @return the object's content; the caller closes it
     * @throws IOException if the object is missing or unreadable
     */
    InputStream open(ObjectRef ref) throws IOException;
}
