/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import cachet.http.*;
import cachet.http.internal.RealHeaders;
import cachet.http.storage.CacheStorage;
import cachet.http.storage.SeparateBodyStorage;
import cachet.http.storage.UnifiedStorage;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import static cachet.http.internal.Utils.closeQuietly;
import static cachet.http.internal.Utils.toNonNegativeLongOrMinusOne;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Decides what to serve from the storage, what to revalidate, and what to store. All methods run on the calling
 * thread. Storage failures never escape: a failed read is a miss and a failed write is logged and dropped.
 */
public final class CacheController {
    private static final System.Logger LOGGER = System.getLogger("cachet.http.Cache");

    /**
     * Status codes that may be stored, RFC 7231 section 6.1. Partial content is not supported.
     */
    static final @NonNull Set<Integer> CACHEABLE_STATUSES = Set.of(200, 203, 300, 301, 308);

    static final @NonNull Set<Integer> PERMANENT_REDIRECT_STATUSES = Set.of(301, 308);

    /**
     * Synthetic response header of the entries of a {@link SeparateBodyStorage}. Every write puts the body under a new
     * generation, and the metadata names the generation it goes with, so a reader never pairs metadata with the body
     * of another write.
     */
    static final @NonNull String BODY_GENERATION = "Cachet-Body-Generation";

    private final @NonNull CacheStorage storage;
    private final @NonNull EntrySerializer serializer;
    private final boolean cacheEtags;
    private final @Nullable Heuristic heuristic;
    private final @NonNull Clock clock;

    public CacheController(final @NonNull CacheStorage storage,
                           final @NonNull EntrySerializer serializer,
                           final boolean cacheEtags,
                           final @Nullable Heuristic heuristic,
                           final @NonNull Clock clock) {
        this.storage = Objects.requireNonNull(storage);
        this.serializer = Objects.requireNonNull(serializer);
        this.cacheEtags = cacheEtags;
        this.heuristic = heuristic;
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @return the key of a {@code GET} of {@code url}.
     */
    public static @NonNull String cacheUrl(final @NonNull String url) {
        return CacheKeys.cacheUrl(url);
    }

    /**
     * @return a fresh stored response for {@code request}, or null if there is none. The returned response is served
     * from the cache, its body must be closed.
     */
    public @Nullable ClientResponse cachedRequest(final @NonNull ClientRequest request) {
        Objects.requireNonNull(request);

        final var requestCaching = request.getCacheControl();
        if (requestCaching.noCache() || requestCaching.maxAgeSeconds() == 0) {
            LOGGER.log(DEBUG, "Request for " + request.getUrl() + " bypasses the cache: " + requestCaching);
            return null;
        }

        final var stored = lookup(request);
        if (stored == null) {
            LOGGER.log(DEBUG, "No stored response for " + request.getUrl());
            return null;
        }

        final var entry = stored.entry;
        if (PERMANENT_REDIRECT_STATUSES.contains(entry.statusCode())) {
            LOGGER.log(DEBUG, "Serving the stored permanent redirect of " + request.getUrl());
            return toResponse(request, stored, CacheStatus.HIT_FRESH);
        }

        final var freshness = new Freshness(clock.instant(), entry.responseHeaders(), entry.sentRequestAt(),
                entry.receivedResponseAt());
        if (freshness.isFresh(requestCaching)) {
            LOGGER.log(DEBUG, "Serving the fresh stored response of " + request.getUrl());
            return toResponse(request, stored, CacheStatus.HIT_FRESH);
        }

        stored.release();
        if (validators(entry.responseHeaders()).isEmpty()) {
            // Can never be revalidated.
            LOGGER.log(DEBUG, "Deleting the stale stored response of " + request.getUrl() + ", it has no validator");
            delete(stored.key);
        } else {
            LOGGER.log(DEBUG, "The stored response of " + request.getUrl() + " is stale");
        }
        return null;
    }

    /**
     * @return the headers that make {@code request} conditional on the stored response, empty if nothing is stored.
     */
    public @NonNull Map<String, String> conditionalHeaders(final @NonNull ClientRequest request) {
        Objects.requireNonNull(request);

        final var stored = lookup(request);
        if (stored == null) {
            return Map.of();
        }
        stored.release();
        return validators(stored.entry.responseHeaders());
    }

    private @NonNull Map<String, String> validators(final @NonNull Headers responseHeaders) {
        final var result = new LinkedHashMap<String, String>();
        final var etag = responseHeaders.get("ETag");
        if (cacheEtags && etag != null) {
            result.put("If-None-Match", etag);
        }
        final var lastModified = responseHeaders.get("Last-Modified");
        if (lastModified != null) {
            result.put("If-Modified-Since", lastModified);
        }
        return result;
    }

    /**
     * @return {@code response} rewritten by the configured heuristic, or {@code response} itself if there is none.
     */
    public @NonNull ClientResponse applyHeuristic(final @NonNull ClientResponse response) {
        Objects.requireNonNull(response);
        return (heuristic != null) ? heuristic.apply(response) : response;
    }

    /**
     * Applies the heuristic to {@code response}, then stores it with {@code body} if it is eligible.
     *
     * @param body the complete body, or null if it is not available.
     */
    public void cacheResponse(final @NonNull ClientRequest request,
                              final @NonNull ClientResponse response,
                              final byte @Nullable [] body) {
        Objects.requireNonNull(request);
        Objects.requireNonNull(response);
        storeResponse(request, applyHeuristic(response), body);
    }

    /**
     * @return true if {@code response} may be stored once its body is complete. It does not look at the body.
     */
    boolean isCacheable(final @NonNull ClientRequest request, final @NonNull ClientResponse response) {
        assert request != null;
        assert response != null;

        if (!CACHEABLE_STATUSES.contains(response.getStatusCode())) {
            LOGGER.log(DEBUG, "Status " + response.getStatusCode() + " of " + request.getUrl() + " is not cacheable");
            return false;
        }
        if (request.getCacheControl().noStore() || response.getCacheControl().noStore()) {
            LOGGER.log(DEBUG, "no-store for " + request.getUrl());
            return false;
        }
        if (CacheKeys.varyFields(response.getHeaders()).contains("*")) {
            LOGGER.log(DEBUG, "Response of " + request.getUrl() + " varies on everything");
            return false;
        }
        if (PERMANENT_REDIRECT_STATUSES.contains(response.getStatusCode())) {
            return true;
        }
        final var freshness = new Freshness(clock.instant(), response.getHeaders(), response.getSentRequestAt(),
                response.getReceivedResponseAt());
        if (!freshness.hasExplicitLifetime() && validators(response.getHeaders()).isEmpty()) {
            LOGGER.log(DEBUG, "Response of " + request.getUrl() + " has neither a lifetime nor a validator");
            return false;
        }
        return true;
    }

    /**
     * Stores {@code response}, whose heuristic was already applied, if it is eligible.
     *
     * @return true if the response was written to the storage.
     */
    boolean storeResponse(final @NonNull ClientRequest request,
                          final @NonNull ClientResponse response,
                          final byte @Nullable [] body) {
        assert request != null;
        assert response != null;

        if (response.getStatusCode() == 304) {
            return false;
        }
        if (!isCacheable(request, response)) {
            // An entry already stored under this key stays as it is.
            return false;
        }

        if (PERMANENT_REDIRECT_STATUSES.contains(response.getStatusCode())) {
            LOGGER.log(DEBUG, "Storing the permanent redirect of " + request.getUrl());
            return write(request, response, new byte[0]);
        }

        if (body == null) {
            return false;
        }
        final var contentLength = toNonNegativeLongOrMinusOne(response.header("Content-Length"));
        if (contentLength != -1L && contentLength != body.length) {
            LOGGER.log(DEBUG, "Body of " + request.getUrl() + " has " + body.length + " bytes but Content-Length is " +
                    contentLength);
            return false;
        }

        LOGGER.log(DEBUG, "Storing the response of " + request.getUrl());
        return write(request, response, body);
    }

    /**
     * Merges the headers of a {@code 304 Not Modified} into the stored response and refreshes its timestamps.
     *
     * @return the refreshed stored response, served from the cache, or {@code notModified} unchanged if nothing is
     * stored for {@code request}.
     */
    public @NonNull ClientResponse updateCachedResponse(final @NonNull ClientRequest request,
                                                        final @NonNull ClientResponse notModified) {
        Objects.requireNonNull(request);
        Objects.requireNonNull(notModified);

        final var stored = lookup(request);
        if (stored == null) {
            LOGGER.log(DEBUG, "304 for " + request.getUrl() + " without a stored response");
            return notModified;
        }

        final var entry = stored.entry;
        final var updated = new CacheEntry(
                entry.url(),
                entry.requestMethod(),
                entry.varyHeaders(),
                entry.statusCode(),
                entry.reason(),
                withBodyGeneration(combine(entry.responseHeaders(), notModified.getHeaders()),
                        entry.responseHeaders().get(BODY_GENERATION)),
                entry.body(),
                notModified.getSentRequestAt(),
                notModified.getReceivedResponseAt());
        try {
            writeEntry(stored.key, updated);
        } catch (UncheckedIOException e) {
            LOGGER.log(WARNING, "Failed to refresh the stored response of " + request.getUrl(), e);
        }
        return toResponse(request, new StoredEntry(stored.key, updated, stored.bodyStream),
                CacheStatus.HIT_STALE_REVALIDATING);
    }

    /**
     * Deletes the stored response of a {@code GET} of {@code request}'s URL, and all its variants.
     *
     * @return the deleted key.
     */
    public @NonNull String invalidate(final @NonNull ClientRequest request) {
        Objects.requireNonNull(request);

        final var key = cacheUrl(request.getUrl().toString());
        try {
            final var raw = readMetadata(key);
            if (raw != null && VariantIndex.isIndex(raw)) {
                final var index = VariantIndex.decode(raw);
                if (index != null) {
                    for (final var variantKey : index.variantKeys()) {
                        remove(variantKey);
                    }
                }
            }
            remove(key);
            LOGGER.log(DEBUG, "Invalidated the stored response of " + request.getUrl());
        } catch (UncheckedIOException e) {
            LOGGER.log(WARNING, "Failed to invalidate the stored response of " + request.getUrl(), e);
        }
        return key;
    }

    private boolean write(final @NonNull ClientRequest request,
                          final @NonNull ClientResponse response,
                          final byte @NonNull [] body) {
        final var url = request.getUrl().toString();
        final var method = request.getMethod();
        final var primaryKey = CacheKeys.derive(method, url, null);
        final var varyFields = CacheKeys.varyFields(response.getHeaders());
        final var entry = new CacheEntry(
                url,
                method,
                varyHeaders(request.getHeaders(), varyFields),
                response.getStatusCode(),
                response.getReason(),
                withBodyGeneration(response.getHeaders(), null),
                body,
                response.getSentRequestAt(),
                response.getReceivedResponseAt());

        try {
            if (varyFields.isEmpty()) {
                writeEntry(primaryKey, entry);
                return true;
            }

            final var variantKey = CacheKeys.derive(method, url,
                    CacheKeys.varyHeaderValues(varyFields, request.getHeaders()));
            writeEntry(variantKey, entry);
            // The variant is in place before the index points to it.
            final var previousRaw = readMetadata(primaryKey);
            final var previous = (previousRaw != null) ? VariantIndex.decode(previousRaw) : null;
            writeMetadata(primaryKey, VariantIndex.of(varyFields, variantKey, previous).encode());
            // The index replaced a plain entry.
            deleteBody(primaryKey, bodyGeneration(previousRaw));
            return true;
        } catch (UncheckedIOException e) {
            LOGGER.log(WARNING, "Failed to store the response of " + url, e);
            return false;
        }
    }

    /**
     * @return the subset of the headers in {@code requestHeaders} that impact the content of the response's body.
     */
    private static @NonNull Headers varyHeaders(final @NonNull Headers requestHeaders,
                                                final @NonNull Set<String> varyFields) {
        if (varyFields.isEmpty()) {
            return Headers.EMPTY;
        }

        final var result = new RealHeaders.Builder();
        for (var i = 0; i < requestHeaders.size(); i++) {
            final var fieldName = requestHeaders.name(i);
            if (varyFields.contains(fieldName)) {
                result.addLenient(fieldName, requestHeaders.value(i));
            }
        }
        return result.build();
    }

    private void writeEntry(final @NonNull String key, final @NonNull CacheEntry entry) {
        if (storage instanceof UnifiedStorage unified) {
            unified.set(key, serializer.encode(entry));
            return;
        }

        final var separate = (SeparateBodyStorage) storage;
        final var body = entry.body();
        if (body == null) {
            // Refreshed metadata, same body generation.
            separate.setMetadata(key, serializer.encode(entry));
            return;
        }
        final var previousGeneration = bodyGeneration(separate.getMetadata(key));
        final var generation = UUID.randomUUID().toString();
        // The body first: metadata makes the entry visible.
        separate.setBody(bodyKey(key, generation), body);
        separate.setMetadata(key, serializer.encode(new CacheEntry(
                entry.url(),
                entry.requestMethod(),
                entry.varyHeaders(),
                entry.statusCode(),
                entry.reason(),
                withBodyGeneration(entry.responseHeaders(), generation),
                null,
                entry.sentRequestAt(),
                entry.receivedResponseAt())));
        deleteBody(key, previousGeneration);
    }

    static @NonNull String bodyKey(final @NonNull String key, final @NonNull String generation) {
        return key + "\nbody " + generation;
    }

    private static @NonNull Headers withBodyGeneration(final @NonNull Headers headers,
                                                       final @Nullable String generation) {
        final var result = headers.newBuilder().removeAll(BODY_GENERATION);
        if (generation != null) {
            result.set(BODY_GENERATION, generation);
        }
        return result.build();
    }

    /**
     * @return the body generation named by the stored {@code metadata}, or null for a variant index, an entry of a
     * unified storage or unreadable metadata.
     */
    private @Nullable String bodyGeneration(final byte @Nullable [] metadata) {
        if (metadata == null || VariantIndex.isIndex(metadata)) {
            return null;
        }
        final var entry = serializer.decode(metadata);
        return (entry != null) ? entry.responseHeaders().get(BODY_GENERATION) : null;
    }

    /**
     * Deletes the body generation {@code generation} of {@code key}. Readers that already opened it keep reading.
     */
    private void deleteBody(final @NonNull String key, final @Nullable String generation) {
        if (generation != null && storage instanceof SeparateBodyStorage separate) {
            separate.delete(bodyKey(key, generation));
        }
    }

    /**
     * Deletes the entry or the variant index stored under {@code key}, with the body its metadata refers to.
     */
    private void remove(final @NonNull String key) {
        final var generation = (storage instanceof SeparateBodyStorage separate)
                ? bodyGeneration(separate.getMetadata(key))
                : null;
        storage.delete(key);
        deleteBody(key, generation);
    }

    private void writeMetadata(final @NonNull String key, final byte @NonNull [] metadata) {
        if (storage instanceof UnifiedStorage unified) {
            unified.set(key, metadata);
        } else {
            ((SeparateBodyStorage) storage).setMetadata(key, metadata);
        }
    }

    private byte @Nullable [] readMetadata(final @NonNull String key) {
        if (storage instanceof UnifiedStorage unified) {
            return unified.get(key);
        }
        return ((SeparateBodyStorage) storage).getMetadata(key);
    }

    private void delete(final @NonNull String key) {
        try {
            remove(key);
        } catch (UncheckedIOException e) {
            LOGGER.log(WARNING, "Failed to delete a stored response", e);
        }
    }

    /**
     * @return the stored entry for {@code request}, following the variant index if there is one, or null if nothing
     * usable is stored.
     */
    private @Nullable StoredEntry lookup(final @NonNull ClientRequest request) {
        final var url = request.getUrl().toString();
        final var method = request.getMethod();
        try {
            var key = CacheKeys.derive(method, url, null);
            var raw = readMetadata(key);
            if (raw == null) {
                return null;
            }

            if (VariantIndex.isIndex(raw)) {
                final var index = VariantIndex.decode(raw);
                if (index == null) {
                    LOGGER.log(WARNING, "Cache corruption: unreadable variant index for " + url);
                    return null;
                }
                key = CacheKeys.derive(method, url, CacheKeys.varyHeaderValues(index.fields(), request.getHeaders()));
                if (!index.variantKeys().contains(key)) {
                    return null;
                }
                raw = readMetadata(key);
                if (raw == null) {
                    return null;
                }
            }

            final var entry = serializer.decode(raw);
            if (entry == null) {
                return null;
            }

            if (storage instanceof UnifiedStorage) {
                if (entry.body() == null) {
                    LOGGER.log(WARNING, "Cache corruption: stored response of " + url + " has no body");
                    return null;
                }
                return new StoredEntry(key, entry, null);
            }
            final var generation = entry.responseHeaders().get(BODY_GENERATION);
            final var bodyStream = ((SeparateBodyStorage) storage).getBody(
                    (generation != null) ? bodyKey(key, generation) : key);
            if (bodyStream == null) {
                return null;
            }
            return new StoredEntry(key, entry, bodyStream);
        } catch (UncheckedIOException e) {
            LOGGER.log(WARNING, "Failed to read the stored response of " + url, e);
            return null;
        }
    }

    private @NonNull ClientResponse toResponse(final @NonNull ClientRequest request,
                                               final @NonNull StoredEntry stored,
                                               final @NonNull CacheStatus cacheStatus) {
        final var entry = stored.entry;
        final ResponseBody body;
        if (stored.bodyStream != null) {
            body = ResponseBody.create(stored.bodyStream,
                    toNonNegativeLongOrMinusOne(entry.responseHeaders().get("Content-Length")), false);
        } else {
            assert entry.body() != null;
            body = ResponseBody.create(entry.body());
        }
        return ClientResponse.builder()
                .request(request)
                .code(entry.statusCode())
                .reason(entry.reason())
                .headers(withBodyGeneration(entry.responseHeaders(), null))
                .body(body)
                .cacheStatus(cacheStatus)
                .sentRequestAt(entry.sentRequestAt())
                .receivedResponseAt(entry.receivedResponseAt())
                .build();
    }

    /**
     * Combines stored headers with the headers of a {@code 304} as defined by RFC 7234, 4.3.4.
     */
    static @NonNull Headers combine(final @NonNull Headers cachedHeaders,
                                    final @NonNull Headers networkHeaders) {
        assert cachedHeaders != null;
        assert networkHeaders != null;

        final var result = new RealHeaders.Builder();

        for (var index = 0; index < cachedHeaders.size(); index++) {
            final var fieldName = cachedHeaders.name(index);
            final var value = cachedHeaders.value(index);
            if ("Warning".equalsIgnoreCase(fieldName) && value.startsWith("1")) {
                // Drop 100-level freshness warnings.
                continue;
            }
            if (isContentSpecificHeader(fieldName) ||
                    !isEndToEnd(fieldName) ||
                    networkHeaders.get(fieldName) == null) {
                result.addLenient(fieldName, value);
            }
        }

        for (var index = 0; index < networkHeaders.size(); index++) {
            final var fieldName = networkHeaders.name(index);
            if (!isContentSpecificHeader(fieldName) && isEndToEnd(fieldName)) {
                result.addLenient(fieldName, networkHeaders.value(index));
            }
        }

        return result.build();
    }

    /**
     * @return true if {@code fieldName} is content specific and therefore should always be used from stored headers.
     */
    private static boolean isContentSpecificHeader(final @NonNull String fieldName) {
        return "Content-Length".equalsIgnoreCase(fieldName) ||
                "Content-Encoding".equalsIgnoreCase(fieldName) ||
                "Content-Type".equalsIgnoreCase(fieldName);
    }

    /**
     * @return true if {@code fieldName} is an end-to-end HTTP header, as defined by RFC 2616, 13.5.1.
     */
    private static boolean isEndToEnd(final @NonNull String fieldName) {
        return !"Connection".equalsIgnoreCase(fieldName) &&
                !"Keep-Alive".equalsIgnoreCase(fieldName) &&
                !"Proxy-Authenticate".equalsIgnoreCase(fieldName) &&
                !"Proxy-Authorization".equalsIgnoreCase(fieldName) &&
                !"TE".equalsIgnoreCase(fieldName) &&
                !"Trailers".equalsIgnoreCase(fieldName) &&
                !"Transfer-Encoding".equalsIgnoreCase(fieldName) &&
                !"Upgrade".equalsIgnoreCase(fieldName);
    }

    private static final class StoredEntry {
        private final @NonNull String key;
        private final @NonNull CacheEntry entry;
        private final @Nullable InputStream bodyStream;

        private StoredEntry(final @NonNull String key,
                            final @NonNull CacheEntry entry,
                            final @Nullable InputStream bodyStream) {
            this.key = key;
            this.entry = entry;
            this.bodyStream = bodyStream;
        }

        private void release() {
            if (bodyStream != null) {
                closeQuietly(bodyStream);
            }
        }
    }
}
