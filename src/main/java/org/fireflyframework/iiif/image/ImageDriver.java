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

import org.fireflyframework.iiif.config.IiifProcessProperties;
import reactor.core.publisher.Mono;

/**
 * Opens source images for a configured image backend.
 *
 * <p>Implementations may block; callers subscribe on a scheduler suited to blocking work.</p>
 */
@FunctionalInterface
public interface ImageDriver {

    /**
     * Opens the image stored under the given origin.
     *
     * @param config the active configuration
     * @param origin the origin of the source image, e.g. {@code avocado.png}
     * @return a {@link Mono} emitting the opened image, or an error if it cannot be read
     */
    Mono<ImageHandle> openImage(IiifProcessProperties config, String origin);
}
