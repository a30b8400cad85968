/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class HeadersTest {
    @Test
    public void lookupIsCaseInsensitive() {
        final var headers = Headers.of("Content-Type", "text/plain", "vary", "Accept", "Vary", "Accept-Language");

        assertThat(headers.get("content-type")).isEqualTo("text/plain");
        assertThat(headers.get("VARY")).isEqualTo("Accept-Language");
        assertThat(headers.values("Vary")).containsExactly("Accept", "Accept-Language");
        assertThat(headers.values("ETag")).isEmpty();
        assertThat(headers.size()).isEqualTo(3);
    }

    @Test
    public void ofRejectsOddNamesAndValues() {
        assertThatThrownBy(() -> Headers.of("Content-Type"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void builderRejectsInvalidCharacters() {
        assertThatThrownBy(() -> Headers.builder().add("Bad Name", "value"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Headers.builder().add("Name", "line\nbreak"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Headers.builder().add("no colon"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void setReplacesAllValues() {
        final var headers = Headers.builder()
                .add("Cache-Control", "no-cache")
                .add("cache-control: max-age=60")
                .set("Cache-Control", "max-age=120")
                .build();

        assertThat(headers.values("Cache-Control")).containsExactly("max-age=120");
    }

    @Test
    public void removeAll() {
        final var headers = Headers.of("ETag", "\"a\"", "Age", "10", "etag", "\"b\"")
                .newBuilder()
                .removeAll("ETag")
                .build();

        assertThat(headers).isEqualTo(Headers.of("Age", "10"));
    }

    @Test
    public void instantValues() {
        final var instant = Instant.parse("2025-06-01T10:00:00Z");
        final var headers = Headers.builder().set("Date", instant).build();

        assertThat(headers.get("Date")).isEqualTo("Sun, 01 Jun 2025 10:00:00 GMT");
        assertThat(headers.getInstant("Date")).isEqualTo(instant);
        assertThat(Headers.of("Expires", "0").getInstant("Expires")).isNull();
    }

    @Test
    public void tokensSplitAllLines() {
        final var headers = Headers.of("Vary", "Accept, ,Accept-Encoding", "vary", " Origin ", "Age", "1");

        assertThat(headers.tokens("VARY")).containsExactly("Accept", "Accept-Encoding", "Origin");
        assertThat(headers.tokens("Cache-Control")).isEmpty();
    }

    @Test
    public void containsIgnoresCase() {
        final var headers = Headers.of("Last-Modified", "Sun, 01 Jun 2025 10:00:00 GMT");

        assertThat(headers.contains("last-modified")).isTrue();
        assertThat(headers.contains("ETag")).isFalse();
        assertThat(Headers.EMPTY.contains("ETag")).isFalse();
    }

    @Test
    public void namesAreDistinctIgnoringCase() {
        final var headers = Headers.of("Vary", "Accept", "vary", "Origin", "Age", "1");

        assertThat(headers.names()).containsExactly("Age", "Vary");
        assertThat(headers.names().contains("VARY")).isTrue();
    }

    @Test
    public void toMultimapGroupsByLowercaseName() {
        final var headers = Headers.of("Vary", "Accept", "vary", "Accept-Language");

        assertThat(headers.toMultimap()).isEqualTo(Map.of("vary", List.of("Accept", "Accept-Language")));
    }

    @Test
    public void toStringRedactsSensitiveHeaders() {
        final var headers = Headers.of("Authorization", "Bearer secret", "Accept", "*/*");

        assertThat(headers.toString())
                .contains("Accept: */*")
                .doesNotContain("secret");
    }
}
