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
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-scoped {@link DerivativesCache} backed by a concurrent map.
 *
 * <p>Suitable for development, testing and single-instance deployments. Contents are lost
 * when the application stops.</p>
 */
@Slf4j
public class InMemoryDerivativesCache implements DerivativesCache {

    public static final String NAME = "memory";

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromSupplier(() -> entries.containsKey(key));
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromSupplier(() -> entries.get(key))
                .map(byte[]::clone);
    }

    @Override
    public Mono<Void> set(String key, byte[] value) {
        return Mono.fromRunnable(() -> {
            entries.put(key, value.clone());
            log.debug("Stored {} bytes under {}", value.length, key);
        });
    }

    @Override
    public Mono<Void> unset(String key) {
        return Mono.fromRunnable(() -> entries.remove(key));
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Returns the number of stored entries.
     */
    public int size() {
        return entries.size();
    }
}
