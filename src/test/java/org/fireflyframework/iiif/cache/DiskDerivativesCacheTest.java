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

import org.fireflyframework.iiif.config.IiifProcessProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DiskDerivativesCache} and {@link DerivativesCaches}.
 */
class DiskDerivativesCacheTest {

    @TempDir
    Path root;

    @Test
    void set_shouldWriteFileBelowRoot() throws Exception {
        // Given
        DiskDerivativesCache cache = new DiskDerivativesCache(root);

        // When
        cache.set("fruit/avocado.png/process.json", "{}".getBytes(StandardCharsets.UTF_8)).block();

        // Then
        Path file = root.resolve("fruit/avocado.png/process.json");
        assertThat(file).exists();
        assertThat(Files.readString(file)).isEqualTo("{}");
        try (Stream<Path> entries = Files.list(file.getParent())) {
            assertThat(entries).containsExactly(file);
        }
    }

    @Test
    void get_shouldReadStoredValue_andBeEmptyWhenMissing() {
        // Given
        DiskDerivativesCache cache = new DiskDerivativesCache(root);
        cache.set("a.json", new byte[]{1, 2, 3}).block();

        // When & Then
        StepVerifier.create(cache.get("a.json"))
                .assertNext(value -> assertThat(value).containsExactly(1, 2, 3))
                .verifyComplete();
        StepVerifier.create(cache.get("b.json"))
                .verifyComplete();
    }

    @Test
    void unset_shouldDeleteFile() {
        // Given
        DiskDerivativesCache cache = new DiskDerivativesCache(root);
        cache.set("a.json", new byte[]{1}).block();

        // When
        cache.unset("a.json").block();

        // Then
        StepVerifier.create(cache.exists("a.json"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void set_shouldRejectKeyEscapingRoot() {
        // Given
        DiskDerivativesCache cache = new DiskDerivativesCache(root.resolve("cache"));

        // When & Then
        StepVerifier.create(cache.set("../outside.json", new byte[]{1}))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertThat(root.resolve("outside.json")).doesNotExist();
    }

    @Test
    void set_shouldRemoveTemporaryFile_whenMoveFails() throws Exception {
        // Given - the key is taken by a non-empty directory
        DiskDerivativesCache cache = new DiskDerivativesCache(root);
        Path occupied = Files.createDirectories(root.resolve("fruit/process.json"));
        Files.writeString(occupied.resolve("keep.txt"), "x");

        // When & Then
        StepVerifier.create(cache.set("fruit/process.json", new byte[]{1}))
                .expectError(UncheckedIOException.class)
                .verify();
        try (Stream<Path> entries = Files.list(root.resolve("fruit"))) {
            assertThat(entries).containsExactly(occupied);
        }
    }

    @Test
    void fromConfig_shouldSelectCacheByName() {
        // Given
        IiifProcessProperties.Cache memory = new IiifProcessProperties.Cache();
        IiifProcessProperties.Cache disk = new IiifProcessProperties.Cache();
        disk.setName("Disk");
        disk.setPath(root.toString());
        IiifProcessProperties.Cache unknown = new IiifProcessProperties.Cache();
        unknown.setName("s3");

        // When & Then
        assertThat(DerivativesCaches.fromConfig(memory)).isInstanceOf(InMemoryDerivativesCache.class);
        assertThat(DerivativesCaches.fromConfig(disk)).isInstanceOfSatisfying(DiskDerivativesCache.class,
                cache -> assertThat(cache.getRoot()).isEqualTo(root.toAbsolutePath().normalize()));
        assertThat(DerivativesCaches.fromConfig(unknown)).isInstanceOf(NullDerivativesCache.class);
    }

    @Test
    void fromConfig_shouldRequirePath_forDiskCache() {
        // Given
        IiifProcessProperties.Cache disk = new IiifProcessProperties.Cache();
        disk.setName("disk");

        // When & Then
        assertThatThrownBy(() -> DerivativesCaches.fromConfig(disk))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("firefly.iiif.derivatives.cache.path");
    }
}
