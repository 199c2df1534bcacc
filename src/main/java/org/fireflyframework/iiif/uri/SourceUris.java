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

import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Parses source URI strings into their {@link SourceUri} variant.
 *
 * <p>Recognised forms:</p>
 * <ul>
 *   <li>{@code avocado.png} or {@code file:///avocado.png} - {@link FileUri}</li>
 *   <li>{@code idsecret:///avocado.png?id=1234&secret=abc&secret_o=def} - {@link IdSecretUri}</li>
 *   <li>{@code rewrite:///avocado.png?target=123/4/1234_abc_b.jpg} - {@link RewriteUri}</li>
 * </ul>
 */
public final class SourceUris {

    private static final String SCHEME_SEPARATOR = "://";

    private SourceUris() {}

    /**
     * Parses a source URI string.
     *
     * @param uri the URI string
     * @return the parsed URI
     * @throws InvalidSourceUriException if the string is blank, malformed or names an unknown driver
     */
    public static SourceUri parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new InvalidSourceUriException("Source URI is required but was blank");
        }

        int schemeEnd = uri.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd < 0) {
            return FileUri.parse(uri);
        }

        String scheme = uri.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        return switch (scheme) {
            case FileUri.DRIVER -> FileUri.parse(uri);
            case IdSecretUri.DRIVER -> IdSecretUri.parse(uri);
            case RewriteUri.DRIVER -> RewriteUri.parse(uri);
            default -> throw new InvalidSourceUriException(
                    "Unsupported source URI driver '" + scheme + "': " + uri);
        };
    }

    static UriComponents components(String uri) {
        try {
            return UriComponentsBuilder.fromUriString(uri).build();
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceUriException("Malformed source URI " + uri + ": " + e.getMessage());
        }
    }

    static String origin(String uri, UriComponents components) {
        String path = components.getPath();
        String origin;
        try {
            origin = path == null ? "" : UriUtils.decode(path, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceUriException("Malformed source URI " + uri + ": " + e.getMessage());
        }
        while (origin.startsWith("/")) {
            origin = origin.substring(1);
        }
        if (origin.isEmpty()) {
            throw new InvalidSourceUriException("Source URI has no origin: " + uri);
        }
        return origin;
    }

    static String queryParam(UriComponents components, String name) {
        String value = components.getQueryParams().getFirst(name);
        if (value == null) {
            return null;
        }
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceUriException("Malformed query parameter '" + name + "': " + e.getMessage());
        }
    }
}
