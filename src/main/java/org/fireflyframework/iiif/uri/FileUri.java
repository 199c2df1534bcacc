/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.iiif.uri;

import lombok.EqualsAndHashCode;

/**
 * Plain source URI: derivatives are processed straight from the origin.
 */
@EqualsAndHashCode
public final class FileUri implements SourceUri {

    public static final String DRIVER = "file";

    private final String uri;
    private final String origin;

    FileUri(String uri, String origin) {
        this.uri = uri;
        this.origin = origin;
    }

    static FileUri parse(String uri) {
        return new FileUri(uri, SourceUris.origin(uri, SourceUris.components(uri)));
    }

    @Override
    public String driver() {
        return DRIVER;
    }

    @Override
    public String origin() {
        return origin;
    }

    @Override
    public String toString() {
        return uri;
    }
}
