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

import reactor.core.publisher.Mono;

/**
 * Byte-oriented store for derivatives and process reports, keyed by path.
 *
 * <p>One instance is created per application and shared by reference with every consumer.</p>
 */
public interface DerivativesCache {

    /**
     * Returns whether a value is stored under the key.
     */
    Mono<Boolean> exists(String key);

    /**
     * Returns the value stored under the key, or an empty {@link Mono} when there is none.
     */
    Mono<byte[]> get(String key);

    /**
     * Stores a value under the key, replacing any previous one.
     */
    Mono<Void> set(String key, byte[] value);

    /**
     * Removes the value stored under the key, if any.
     */
    Mono<Void> unset(String key);

    /**
     * Returns the cache name as used in configuration, e.g. {@code memory}.
     */
    String getName();
}
