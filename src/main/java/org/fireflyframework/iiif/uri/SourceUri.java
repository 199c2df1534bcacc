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

/**
 * Handle naming a source image and the URI variant it was written in.
 *
 * <p>Variants are concrete classes chosen once by {@link SourceUris#parse(String)}.
 * {@link #toString()} returns the URI as it was given.</p>
 */
public interface SourceUri {

    /**
     * Returns the name of the URI variant, e.g. {@code file}, {@code idsecret} or {@code rewrite}.
     */
    String driver();

    /**
     * Returns the origin of the source image, e.g. {@code avocado.png}.
     */
    String origin();
}
