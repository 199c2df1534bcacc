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
 * {@link DerivativesCache} that stores nothing. Writes succeed and reads find nothing.
 */
public class NullDerivativesCache implements DerivativesCache {

    public static final String NAME = "null";

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.just(false);
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> set(String key, byte[] value) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> unset(String key) {
        return Mono.empty();
    }

    @Override
    public String getName() {
        return NAME;
    }
}
