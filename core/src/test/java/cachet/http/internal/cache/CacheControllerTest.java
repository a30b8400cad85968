/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import cachet.http.*;
import cachet.http.storage.InMemoryStorage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public final class CacheControllerTest {
    private static final String URL = "https://example.com/widgets";

    private final MutableClock clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
    private final InMemoryStorage storage = new InMemoryStorage();
    private final CacheController controller =
            new CacheController(storage, EntrySerializer.standard(), true, null, clock);

    @Test
    public void storedResponseIsServedWhileFresh() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200, "Cache-Control", "max-age=60"), bytes("A"));

        clock.advance(Duration.ofSeconds(59));
        try (final var cached = controller.cachedRequest(request)) {
            assertThat(cached).isNotNull();
            assertThat(cached.getCacheStatus()).isEqualTo(CacheStatus.HIT_FRESH);
            assertThat(cached.getBody().string()).isEqualTo("A");
        }

        clock.advance(Duration.ofSeconds(1));
        assertThat(controller.cachedRequest(request)).isNull();
    }

    @Test
    public void storingTwiceKeepsOneEntry() {
        final var request = ClientRequest.get(URL);
        final var response = response(request, 200, "Cache-Control", "max-age=60");

        controller.cacheResponse(request, response, bytes("A"));
        controller.cacheResponse(request, response, bytes("A"));

        assertThat(storage.size()).isEqualTo(1);
    }

    @Test
    public void uncacheableStatusIsNotStored() {
        final var request = ClientRequest.get(URL);

        controller.cacheResponse(request, response(request, 404, "Cache-Control", "max-age=60"), bytes("A"));
        controller.cacheResponse(request, response(request, 206, "Cache-Control", "max-age=60"), bytes("A"));

        assertThat(storage.size()).isZero();
    }

    @Test
    public void contentLengthMismatchIsNotStored() {
        final var request = ClientRequest.get(URL);

        controller.cacheResponse(request,
                response(request, 200, "Cache-Control", "max-age=60", "Content-Length", "10"), bytes("short"));

        assertThat(storage.size()).isZero();
    }

    @Test
    public void missingBodyIsNotStored() {
        final var request = ClientRequest.get(URL);

        controller.cacheResponse(request, response(request, 200, "Cache-Control", "max-age=60"), null);

        assertThat(storage.size()).isZero();
    }

    @Test
    public void noStoreRequestLeavesStoredResponse() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200, "Cache-Control", "max-age=60"), bytes("A"));

        final var noStore = request.newBuilder().header("Cache-Control", "no-store").get();
        controller.cacheResponse(noStore, response(noStore, 200, "Cache-Control", "max-age=60"), bytes("B"));

        assertThat(storage.size()).isEqualTo(1);
        try (final var cached = controller.cachedRequest(request)) {
            assertThat(cached).isNotNull();
            assertThat(cached.getBody().string()).isEqualTo("A");
        }
    }

    @Test
    public void noStoreResponseLeavesStoredResponse() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200, "Cache-Control", "max-age=60"), bytes("A"));

        controller.cacheResponse(request, response(request, 200, "Cache-Control", "no-store"), bytes("B"));

        assertThat(storage.size()).isEqualTo(1);
        try (final var cached = controller.cachedRequest(request)) {
            assertThat(cached).isNotNull();
            assertThat(cached.getCacheStatus()).isEqualTo(CacheStatus.HIT_FRESH);
            assertThat(cached.getBody().string()).isEqualTo("A");
        }
    }

    @Test
    public void permanentRedirectIsStoredWithoutBody() {
        final var request = ClientRequest.get(URL);

        controller.cacheResponse(request, response(request, 308, "Location", "https://example.com/gadgets"), null);

        clock.advance(Duration.ofDays(365));
        try (final var cached = controller.cachedRequest(request)) {
            assertThat(cached).isNotNull();
            assertThat(cached.getStatusCode()).isEqualTo(308);
            assertThat(cached.getBody().bytes()).isEmpty();
        }
    }

    @Test
    public void maxAgeZeroRequestSkipsLookup() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200, "Cache-Control", "max-age=60"), bytes("A"));

        final var revalidate = request.newBuilder()
                .cacheControl(CacheControl.builder().maxAge(Duration.ZERO).build())
                .get();
        assertThat(controller.cachedRequest(revalidate)).isNull();
        assertThat(storage.size()).isEqualTo(1);
    }

    @Test
    public void conditionalHeadersUseBothValidators() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200,
                "ETag", "\"v1\"", "Last-Modified", "Sun, 01 Jun 2025 09:00:00 GMT"), bytes("A"));

        assertThat(controller.conditionalHeaders(request))
                .containsEntry("If-None-Match", "\"v1\"")
                .containsEntry("If-Modified-Since", "Sun, 01 Jun 2025 09:00:00 GMT")
                .hasSize(2);
    }

    @Test
    public void etagIsIgnoredWhenDisabled() {
        final var withoutEtags = new CacheController(storage, EntrySerializer.standard(), false, null, clock);
        final var request = ClientRequest.get(URL);

        withoutEtags.cacheResponse(request, response(request, 200, "ETag", "\"v1\""), bytes("A"));

        assertThat(storage.size()).isZero();
        assertThat(withoutEtags.conditionalHeaders(request)).isEmpty();
    }

    @Test
    public void notModifiedRefreshesStoredResponse() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200,
                "Cache-Control", "max-age=60", "ETag", "\"v1\"", "Content-Type", "text/plain"), bytes("A"));

        clock.advance(Duration.ofMinutes(5));
        assertThat(controller.cachedRequest(request)).isNull();

        final var notModified = response(request, 304,
                "Cache-Control", "max-age=600", "Content-Type", "text/html", "Connection", "close");
        try (final var merged = controller.updateCachedResponse(request, notModified)) {
            assertThat(merged.getCacheStatus()).isEqualTo(CacheStatus.HIT_STALE_REVALIDATING);
            assertThat(merged.getStatusCode()).isEqualTo(200);
            assertThat(merged.header("Cache-Control")).isEqualTo("max-age=600");
            assertThat(merged.header("Content-Type")).isEqualTo("text/plain");
            assertThat(merged.header("Connection")).isNull();
            assertThat(merged.getReceivedResponseAt()).isEqualTo(clock.instant());
            assertThat(merged.getBody().string()).isEqualTo("A");
        }

        assertThat(controller.cachedRequest(request)).isNotNull();
    }

    @Test
    public void notModifiedWithoutStoredResponseIsReturnedAsIs() {
        final var request = ClientRequest.get(URL);
        final var notModified = response(request, 304);

        assertThat(controller.updateCachedResponse(request, notModified)).isSameAs(notModified);
    }

    @Test
    public void combineDropsFreshnessWarnings() {
        final var combined = CacheController.combine(
                Headers.of("Warning", "110 stale", "Warning", "299 misc", "ETag", "\"v1\"", "Age", "10"),
                Headers.of("Age", "0", "Content-Length", "99"));

        assertThat(combined.values("Warning")).containsExactly("299 misc");
        assertThat(combined.get("ETag")).isEqualTo("\"v1\"");
        assertThat(combined.values("Age")).containsExactly("0");
        assertThat(combined.get("Content-Length")).isNull();
    }

    @Test
    public void invalidateReturnsPrimaryKey() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, 200, "Cache-Control", "max-age=60"), bytes("A"));

        final var delete = request.newBuilder().delete();
        assertThat(controller.invalidate(delete)).isEqualTo(CacheController.cacheUrl(URL));
        assertThat(storage.size()).isZero();
    }

    @Test
    public void corruptEntryIsAMiss() {
        final var request = ClientRequest.get(URL);
        storage.set(CacheController.cacheUrl(URL), bytes("garbage"));

        assertThat(controller.cachedRequest(request)).isNull();
        assertThat(controller.conditionalHeaders(request)).isEmpty();
    }

    @Test
    public void heuristicIsAppliedBeforeStoring() {
        final Heuristic oneHour = response -> response.newBuilder().header("Cache-Control", "max-age=3600").build();
        final var withHeuristic = new CacheController(storage, EntrySerializer.standard(), true, oneHour, clock);
        final var request = ClientRequest.get(URL);

        withHeuristic.cacheResponse(request, response(request, 200), bytes("A"));

        clock.advance(Duration.ofMinutes(30));
        assertThat(withHeuristic.cachedRequest(request)).isNotNull();
    }

    private ClientResponse response(final ClientRequest request, final int code, final String... headers) {
        return ClientResponse.builder()
                .request(request)
                .code(code)
                .headers(Headers.of(headers))
                .sentRequestAt(clock.instant())
                .receivedResponseAt(clock.instant())
                .build();
    }

    private static byte[] bytes(final String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
