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

package org.fireflyframework.iiif.process;

import org.fireflyframework.iiif.model.Dimensions;
import org.fireflyframework.iiif.model.PaletteColor;
import org.fireflyframework.iiif.model.ProcessManifest;
import org.fireflyframework.iiif.model.TaskFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates the results of one source's tasks as they complete.
 *
 * <p>All state is guarded by a single lock, held only for the write of one task's result.</p>
 */
final class ManifestCollector {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, String> uris = new TreeMap<>();
    private final Map<String, List<Integer>> dimensions = new TreeMap<>();
    private final List<TaskFailure> failures = new ArrayList<>();
    private List<PaletteColor> palette;

    void recordDerivative(String label, String uri, Dimensions size) {
        lock.lock();
        try {
            uris.put(label, uri);
            dimensions.put(label, size.asList());
        } finally {
            lock.unlock();
        }
    }

    void recordPalette(List<PaletteColor> colors) {
        lock.lock();
        try {
            palette = List.copyOf(colors);
        } finally {
            lock.unlock();
        }
    }

    void recordFailure(TaskFailure failure) {
        lock.lock();
        try {
            failures.add(failure);
        } finally {
            lock.unlock();
        }
    }

    ProcessManifest toManifest() {
        lock.lock();
        try {
            List<TaskFailure> sortedFailures = new ArrayList<>(failures);
            sortedFailures.sort(Comparator.comparing(TaskFailure::getTask));
            return ProcessManifest.builder()
                    .uris(Collections.unmodifiableMap(new TreeMap<>(uris)))
                    .dimensions(Collections.unmodifiableMap(new TreeMap<>(dimensions)))
                    .palette(palette)
                    .failures(List.copyOf(sortedFailures))
                    .build();
        } finally {
            lock.unlock();
        }
    }
}
