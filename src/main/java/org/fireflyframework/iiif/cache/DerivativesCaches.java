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

package org.fireflyframework.iiif.cache;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.config.IiifProcessProperties;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Creates the {@link DerivativesCache} named in configuration.
 */
@Slf4j
public final class DerivativesCaches {

    private DerivativesCaches() {}

    /**
     * Creates a cache from its configuration. Unknown names yield a {@link NullDerivativesCache}.
     *
     * @param config the cache configuration
     * @return the cache
     * @throws IllegalArgumentException if a disk cache has no path
     */
    public static DerivativesCache fromConfig(IiifProcessProperties.Cache config) {
        String name = config.getName() == null ? "" : config.getName().trim().toLowerCase(Locale.ROOT);

        return switch (name) {
            case InMemoryDerivativesCache.NAME -> new InMemoryDerivativesCache();
            case DiskDerivativesCache.NAME -> {
                if (config.getPath() == null || config.getPath().isBlank()) {
                    throw new IllegalArgumentException("Disk derivatives cache requires firefly.iiif.derivatives.cache.path");
                }
                yield new DiskDerivativesCache(Path.of(config.getPath()));
            }
            case NullDerivativesCache.NAME -> new NullDerivativesCache();
            default -> {
                log.warn("Unknown derivatives cache '{}', falling back to the null cache", config.getName());
                yield new NullDerivativesCache();
            }
        };
    }
}
