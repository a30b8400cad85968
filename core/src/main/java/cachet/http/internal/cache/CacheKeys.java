/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import cachet.http.Headers;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

import static cachet.http.internal.Utils.hexDigest;

/**
 * Derives storage keys from requests. A key is the lowercase hex SHA-256 of the normalized request line, followed,
 * for a variant of a response that declares {@code Vary}, by the values of the varied request headers.
 * <p>
 * Keys never depend on headers that the stored response does not vary on.
 */
public final class CacheKeys {
    // un-instantiable
    private CacheKeys() {
    }

    /**
     * @return the key of a {@code GET} of {@code url}.
     * @throws IllegalArgumentException if {@code url} is not an absolute URL.
     */
    public static @NonNull String cacheUrl(final @NonNull String url) {
        Objects.requireNonNull(url);
        return derive("GET", url, null);
    }

    /**
     * @param varyHeaderValues the values of the varied request headers, by lowercase name, as returned by
     *                         {@link #varyHeaderValues(Set, Headers)}. Null for the primary key of the request.
     * @throws IllegalArgumentException if {@code url} is not an absolute URL.
     */
    public static @NonNull String derive(final @NonNull String method,
                                         final @NonNull String url,
                                         final @Nullable SortedMap<String, List<String>> varyHeaderValues) {
        Objects.requireNonNull(method);
        Objects.requireNonNull(url);

        final var sb = new StringBuilder();
        final var upperMethod = method.toUpperCase(Locale.US);
        if (!upperMethod.equals("GET")) {
            sb.append(upperMethod).append(' ');
        }
        sb.append(normalizeUrl(url));
        if (varyHeaderValues != null) {
            sb.append("\nvary");
            for (final var entry : varyHeaderValues.entrySet()) {
                sb.append('\n').append(entry.getKey());
                // An absent header has no colon, unlike a present but empty one.
                if (!entry.getValue().isEmpty()) {
                    sb.append(": ").append(String.join(", ", entry.getValue()));
                }
            }
        }
        return hexDigest("SHA-256", sb.toString());
    }

    /**
     * @return the values of the {@code fields} of {@code requestHeaders}, keyed by lowercase field name. A field
     * missing from the request maps to an empty list.
     */
    public static @NonNull SortedMap<String, List<String>> varyHeaderValues(
            final @NonNull Set<String> fields,
            final @NonNull Headers requestHeaders) {
        Objects.requireNonNull(fields);
        Objects.requireNonNull(requestHeaders);

        final var result = new TreeMap<String, List<String>>();
        for (final var field : fields) {
            result.put(field.toLowerCase(Locale.US), requestHeaders.values(field));
        }
        return result;
    }

    /**
     * Lowercases the scheme and the authority, drops the fragment, and turns an empty path into {@code /}. The query
     * is kept as is.
     *
     * @throws IllegalArgumentException if {@code url} is not an absolute URL.
     */
    public static @NonNull String normalizeUrl(final @NonNull String url) {
        Objects.requireNonNull(url);

        final URI uri;
        try {
            uri = new URI(url.strip());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        if (!uri.isAbsolute() || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Expected an absolute URL: " + url);
        }

        final var sb = new StringBuilder()
                .append(uri.getScheme().toLowerCase(Locale.US))
                .append("://")
                .append(uri.getRawAuthority().toLowerCase(Locale.US));
        final var path = uri.getRawPath();
        sb.append((path == null || path.isEmpty()) ? "/" : path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * @return the field names of the {@code Vary} headers of a response, case-insensitively sorted. The set contains
     * {@code *} if the response varies on everything.
     */
    public static @NonNull Set<String> varyFields(final @NonNull Headers responseHeaders) {
        Objects.requireNonNull(responseHeaders);

        final var fields = responseHeaders.tokens("Vary");
        if (fields.isEmpty()) {
            return Set.of();
        }
        final var result = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        result.addAll(fields);
        return result;
    }
}
