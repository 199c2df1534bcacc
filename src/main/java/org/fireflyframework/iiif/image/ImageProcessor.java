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

package org.fireflyframework.iiif.image;

import org.fireflyframework.iiif.model.Instructions;
import org.fireflyframework.iiif.uri.SourceUri;
import reactor.core.publisher.Mono;

/**
 * Produces a derivative image from a source URI.
 *
 * <p>For rewriting sources the URI passed in is a
 * {@link org.fireflyframework.iiif.uri.RewriteUri} naming the derivative target.</p>
 */
@FunctionalInterface
public interface ImageProcessor {

    /**
     * Applies resolved instructions to the image behind {@code uri}.
     *
     * @param uri          the effective processing URI
     * @param label        the derivative label
     * @param instructions the resolved instructions
     * @return a {@link Mono} emitting the derivative's URI and image
     */
    Mono<ProcessedDerivative> process(SourceUri uri, String label, Instructions instructions);
}
