/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class JdkHttpTransportTest {
    private final BlockingQueue<String> responses = new LinkedBlockingQueue<>();
    private final List<Map<String, String>> requests = new CopyOnWriteArrayList<>();
    private ServerSocket server;
    private Thread acceptor;
    private JdkHttpTransport transport;

    @BeforeEach
    public void setUp() throws IOException {
        server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        acceptor = new Thread(this::serve, "test-server");
        acceptor.setDaemon(true);
        acceptor.start();
        transport = new JdkHttpTransport(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build());
    }

    @AfterEach
    public void tearDown() throws IOException {
        server.close();
    }

    /**
     * Answers each connection with the next enqueued raw response, then closes it.
     */
    private void serve() {
        while (!server.isClosed()) {
            try (final Socket socket = server.accept()) {
                final var reader = new BufferedReader(
                        new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
                final var headers = new TreeMap<String, String>();
                headers.put(":request", reader.readLine());
                String line;
                while ((line = reader.readLine()) != null && !line.isEmpty()) {
                    final var colon = line.indexOf(':');
                    headers.put(line.substring(0, colon).trim().toLowerCase(Locale.US),
                            line.substring(colon + 1).trim());
                }
                final var contentLength = headers.get("content-length");
                if (contentLength != null) {
                    final var body = new char[Integer.parseInt(contentLength)];
                    var read = 0;
                    while (read < body.length) {
                        final var count = reader.read(body, read, body.length - read);
                        if (count == -1) {
                            break;
                        }
                        read += count;
                    }
                    headers.put(":body", new String(body, 0, read));
                }
                requests.add(headers);
                final var response = responses.take();
                socket.getOutputStream().write(response.getBytes(StandardCharsets.ISO_8859_1));
                socket.getOutputStream().flush();
            } catch (IOException e) {
                if (!server.isClosed()) {
                    throw new UncheckedIOException(e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void enqueue(final String statusLine, final String body, final String... headers) {
        final var response = new StringBuilder(statusLine).append("\r\n");
        for (var i = 0; i < headers.length; i += 2) {
            response.append(headers[i]).append(": ").append(headers[i + 1]).append("\r\n");
        }
        if (!statusLine.contains(" 304 ")) {
            response.append("Content-Length: ").append(body.length()).append("\r\n");
        }
        response.append("Connection: close\r\n\r\n").append(body);
        responses.add(response.toString());
    }

    private String url(final String path) {
        return "http://127.0.0.1:" + server.getLocalPort() + path;
    }

    @Test
    public void responseIsMapped() {
        enqueue("HTTP/1.1 200 OK", "hello", "Cache-Control", "max-age=60", "X-Custom", "a");
        final var request = ClientRequest.builder()
                .url(url("/hello"))
                .header("X-Test", "value")
                .header("Host", "ignored.example.com")
                .get();

        try (final var response = transport.execute(request)) {
            assertThat(response.getStatusCode()).isEqualTo(200);
            assertThat(response.getRequest()).isSameAs(request);
            assertThat(response.header("Cache-Control")).isEqualTo("max-age=60");
            assertThat(response.header("x-custom")).isEqualTo("a");
            assertThat(response.getBody().contentByteSize()).isEqualTo(5L);
            assertThat(response.getBody().string()).isEqualTo("hello");
            assertThat(response.getReceivedResponseAt()).isAfterOrEqualTo(response.getSentRequestAt());
        }

        final var recorded = requests.get(0);
        assertThat(recorded.get(":request")).isEqualTo("GET /hello HTTP/1.1");
        assertThat(recorded.get("x-test")).isEqualTo("value");
        assertThat(recorded.get("host")).isEqualTo("127.0.0.1:" + server.getLocalPort());
    }

    @Test
    public void requestBodyIsSent() {
        enqueue("HTTP/1.1 201 Created", "");

        try (final var response = transport.execute(
                ClientRequest.builder().url(url("/widgets")).post("abc".getBytes(StandardCharsets.UTF_8)))) {
            assertThat(response.getStatusCode()).isEqualTo(201);
        }
        assertThat(requests.get(0).get(":request")).isEqualTo("POST /widgets HTTP/1.1");
        assertThat(requests.get(0).get("content-length")).isEqualTo("3");
        assertThat(requests.get(0).get(":body")).isEqualTo("abc");
    }

    @Test
    public void cachedTransportHitsServerOnce() {
        enqueue("HTTP/1.1 200 OK", "hello", "Cache-Control", "max-age=60");
        final var cached = Cache.builder().build().wrap(transport);

        try (final var first = cached.execute(ClientRequest.get(url("/hello")))) {
            assertThat(first.getBody().string()).isEqualTo("hello");
        }
        try (final var second = cached.execute(ClientRequest.get(url("/hello")))) {
            assertThat(second.getCacheStatus()).isEqualTo(CacheStatus.HIT_FRESH);
            assertThat(second.getBody().string()).isEqualTo("hello");
        }
        assertThat(requests).hasSize(1);
    }

    @Test
    public void cachedTransportRevalidates() {
        enqueue("HTTP/1.1 200 OK", "tagged", "ETag", "\"v1\"", "Cache-Control", "no-cache");
        enqueue("HTTP/1.1 304 Not Modified", "", "ETag", "\"v1\"");
        final var cached = Cache.builder().build().wrap(transport);

        try (final var first = cached.execute(ClientRequest.get(url("/etag")))) {
            assertThat(first.getBody().string()).isEqualTo("tagged");
        }
        try (final var second = cached.execute(ClientRequest.get(url("/etag")))) {
            assertThat(second.getCacheStatus()).isEqualTo(CacheStatus.HIT_STALE_REVALIDATING);
            assertThat(second.getStatusCode()).isEqualTo(200);
            assertThat(second.getBody().string()).isEqualTo("tagged");
        }
        assertThat(requests).hasSize(2);
        assertThat(requests.get(0).get("if-none-match")).isNull();
        assertThat(requests.get(1).get("if-none-match")).isEqualTo("\"v1\"");
    }

    @Test
    public void connectionFailureIsUnchecked() throws IOException {
        final int port;
        try (final var socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        assertThatThrownBy(() -> transport.execute(ClientRequest.get("http://127.0.0.1:" + port + "/")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
