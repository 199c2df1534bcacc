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

package org.fireflyframework.iiif.model;

/**
 * Kinds of per-task failure recorded in a {@link ProcessManifest}.
 *
 * <ul>
 *   <li>{@link #SOURCE_OPEN} - the driver could not open the source image</li>
 *   <li>{@link #PALETTE} - the palette could not be computed</li>
 *   <li>{@link #REWRITE} - the target URI could not be derived for a rewriting source</li>
 *   <li>{@link #DERIVATIVE_PROCESSING} - the processor failed to produce the derivative</li>
 *   <li>{@link #DIMENSION_QUERY} - the derivative did not report its size</li>
 * </ul>
 */
public enum FailureKind {

    SOURCE_OPEN,
    PALETTE,
    REWRITE,
    DERIVATIVE_PROCESSING,
    DIMENSION_QUERY
}
