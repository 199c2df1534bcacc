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

package org.fireflyframework.iiif.uri;

import lombok.EqualsAndHashCode;
import org.springframework.web.util.UriComponents;

/**
 * Source URI carrying an explicit derivative target, produced by {@link UriRewriter}
 * for {@link TargetDerivingUri} sources.
 */
@EqualsAndHashCode
public final class RewriteUri implements SourceUri {

    public static final String DRIVER = "rewrite";

    private static final String PREFIX = DRIVER + ":///";

    private final String uri;
    private final String origin;
    private final String target;

    private RewriteUri(String uri, String origin, String target) {
        this.uri = uri;
        this.origin = origin;
        this.target = target;
    }

    static RewriteUri parse(String uri) {
        UriComponents components = SourceUris.components(uri);
        String target = SourceUris.queryParam(components, "target");
        if (target == null || target.isBlank()) {
            throw new InvalidSourceUriException("Rewrite URI is missing a target: " + uri);
        }
        return new RewriteUri(uri, SourceUris.origin(uri, components), target);
    }

    /**
     * Normalises {@code <origin>?target=<target>} into a rewrite URI string.
     *
     * @param str the origin and target query
     * @return the string prefixed with the rewrite scheme
     */
    public static String toRewriteString(String str) {
        if (str.startsWith(PREFIX)) {
            return str;
        }
        while (str.startsWith("/")) {
            str = str.substring(1);
        }
        return PREFIX + str;
    }

    @Override
    public String driver() {
        return DRIVER;
    }

    @Override
    public String origin() {
        return origin;
    }

    /**
     * Returns the path the derivative is written to.
     */
    public String target() {
        return target;
    }

    @Override
    public String toString() {
        return uri;
    }
}
