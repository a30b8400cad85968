/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import cachet.http.internal.RealHeaders;
import org.jspecify.annotations.NonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import static cachet.http.internal.Utils.toNonNegativeLongOrMinusOne;

/**
 * A {@link Transport} backed by the JDK's {@link HttpClient}. Response bodies are streamed, never buffered.
 * <p>
 * The headers that the JDK client manages itself, like {@code Host} or {@code Content-Length}, are not forwarded.
 */
public final class JdkHttpTransport implements Transport {
    private static final @NonNull Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final @NonNull HttpClient client;

    public JdkHttpTransport(final @NonNull HttpClient client) {
        this.client = Objects.requireNonNull(client);
    }

    /**
     * @throws UncheckedIOException if the request failed, or was interrupted. The interrupt status of the thread is
     *                              kept.
     */
    @Override
    public @NonNull ClientResponse execute(final @NonNull ClientRequest request) {
        Objects.requireNonNull(request);

        final var body = request.getBody();
        final var builder = HttpRequest.newBuilder(request.getUrl())
                .method(request.getMethod(), (body != null)
                        ? HttpRequest.BodyPublishers.ofByteArray(body)
                        : HttpRequest.BodyPublishers.noBody());
        final var headers = request.getHeaders();
        for (var i = 0; i < headers.size(); i++) {
            final var name = headers.name(i);
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.US))) {
                builder.header(name, headers.value(i));
            }
        }

        final var sentRequestAt = Instant.now();
        final HttpResponse<InputStream> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UncheckedIOException(new InterruptedIOException("Interrupted while sending " + request));
        }

        final var responseHeaders = new RealHeaders.Builder();
        response.headers().map().forEach((name, values) -> {
            // HTTP/2 pseudo headers
            if (name.startsWith(":")) {
                return;
            }
            for (final var value : values) {
                responseHeaders.addLenient(name, value);
            }
        });
        final var networkHeaders = responseHeaders.build();
        final var chunked = networkHeaders.tokens("Transfer-Encoding").stream()
                .anyMatch("chunked"::equalsIgnoreCase);
        final var contentLength = toNonNegativeLongOrMinusOne(networkHeaders.get("Content-Length"));

        return ClientResponse.builder()
                .request(request)
                .code(response.statusCode())
                .headers(networkHeaders)
                .body(ResponseBody.create(response.body(), contentLength, chunked))
                .sentRequestAt(sentRequestAt)
                .receivedResponseAt(Instant.now())
                .build();
    }
}
