/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static cachet.http.internal.DateFormatting.toHttpInstantOrNull;
import static cachet.http.internal.DateFormatting.toHttpInstantString;
import static org.assertj.core.api.Assertions.assertThat;

public final class DateFormattingTest {
    private static final Instant NOV_6_1994 = Instant.parse("1994-11-06T08:49:37Z");

    @Test
    public void imfFixdate() {
        assertThat(toHttpInstantOrNull("Sun, 06 Nov 1994 08:49:37 GMT")).isEqualTo(NOV_6_1994);
        assertThat(toHttpInstantString(NOV_6_1994)).isEqualTo("Sun, 06 Nov 1994 08:49:37 GMT");
    }

    @Test
    public void obsoleteForms() {
        assertThat(toHttpInstantOrNull("Sunday, 06-Nov-94 08:49:37 GMT")).isEqualTo(NOV_6_1994);
        assertThat(toHttpInstantOrNull("Sun Nov  6 08:49:37 1994")).isEqualTo(NOV_6_1994);
    }

    @Test
    public void numericOffset() {
        assertThat(toHttpInstantOrNull("Sun, 6 Nov 1994 09:49:37 +0100")).isEqualTo(NOV_6_1994);
    }

    @Test
    public void invalidDatesAreNull() {
        assertThat(toHttpInstantOrNull("0")).isNull();
        assertThat(toHttpInstantOrNull("  ")).isNull();
        assertThat(toHttpInstantOrNull("tomorrow")).isNull();
    }
}
