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
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link DerivativesCache} storing each key as a file below a root directory.
 *
 * <p>Keys are resolved relative to the root; keys escaping it are rejected. Writes go to a
 * temporary file first and are moved into place.</p>
 */
@Slf4j
public class DiskDerivativesCache implements DerivativesCache {

    public static final String NAME = "disk";

    private final Path root;

    public DiskDerivativesCache(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> Files.isRegularFile(resolve(key)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromCallable(() -> {
                    try {
                        return Files.readAllBytes(resolve(key));
                    } catch (NoSuchFileException e) {
                        return null;
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> set(String key, byte[] value) {
        return Mono.<Void>fromRunnable(() -> {
                    Path target = resolve(key);
                    Path temp = null;
                    try {
                        Files.createDirectories(target.getParent());
                        temp = Files.createTempFile(target.getParent(), ".cache-", ".tmp");
                        Files.write(temp, value);
                        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                    } catch (IOException e) {
                        deleteQuietly(temp, e);
                        throw new UncheckedIOException("Unable to write " + target, e);
                    }
                    log.debug("Wrote {} bytes to {}", value.length, target);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> unset(String key) {
        return Mono.<Void>fromRunnable(() -> {
                    try {
                        Files.deleteIfExists(resolve(key));
                    } catch (IOException e) {
                        throw new UncheckedIOException("Unable to delete " + key, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public String getName() {
        return NAME;
    }

    public Path getRoot() {
        return root;
    }

    private void deleteQuietly(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Cache key escapes the cache root: " + key);
        }
        return path;
    }
}
