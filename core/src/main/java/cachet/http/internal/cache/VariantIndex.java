/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Stored under the primary key of a request whose response declares {@code Vary}. It names the varied request fields,
 * and the variant keys stored so far so that they can all be invalidated together.
 * <pre>
 * {@code
 * cachet-vary-index 1
 * accept-language
 * 3f2a...
 * 9b07...
 * }
 * </pre>
 * The first line is the version. Next is one line with the comma-separated varied fields, then one variant key per
 * line.
 */
record VariantIndex(@NonNull Set<String> fields, @NonNull Set<String> variantKeys) {
    private static final byte @NonNull [] MAGIC = "cachet-vary-index 1\n".getBytes(StandardCharsets.UTF_8);

    static boolean isIndex(final byte @NonNull [] data) {
        assert data != null;
        return data.length >= MAGIC.length && Arrays.equals(data, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
    }

    /**
     * @return the index read from {@code data}, or null if {@code data} is not a valid index.
     */
    static @Nullable VariantIndex decode(final byte @NonNull [] data) {
        assert data != null;

        if (!isIndex(data)) {
            return null;
        }
        final var text = new String(data, MAGIC.length, data.length - MAGIC.length, StandardCharsets.UTF_8);
        final var lines = text.split("\n");
        if (lines.length == 0 || lines[0].isEmpty()) {
            return null;
        }
        final var fields = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        fields.addAll(Arrays.asList(lines[0].split(",")));
        final var variantKeys = new LinkedHashSet<String>();
        for (var i = 1; i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                variantKeys.add(lines[i]);
            }
        }
        return new VariantIndex(Collections.unmodifiableSet(fields), Collections.unmodifiableSet(variantKeys));
    }

    /**
     * @return an index for {@code fields} listing {@code variantKey}, plus the keys of {@code previous} if it varies on
     * the same fields.
     */
    static @NonNull VariantIndex of(final @NonNull Set<String> fields,
                                    final @NonNull String variantKey,
                                    final @Nullable VariantIndex previous) {
        assert fields != null;
        assert variantKey != null;

        final var sortedFields = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (final var field : fields) {
            sortedFields.add(field.toLowerCase(Locale.US));
        }
        final var variantKeys = new LinkedHashSet<String>();
        if (previous != null && previous.fields.equals(sortedFields)) {
            variantKeys.addAll(previous.variantKeys);
        }
        variantKeys.add(variantKey);
        return new VariantIndex(Collections.unmodifiableSet(sortedFields), Collections.unmodifiableSet(variantKeys));
    }

    byte @NonNull [] encode() {
        final var text = new StringBuilder()
                .append(String.join(",", fields)).append('\n');
        for (final var variantKey : variantKeys) {
            text.append(variantKey).append('\n');
        }
        final var body = text.toString().getBytes(StandardCharsets.UTF_8);
        final var result = Arrays.copyOf(MAGIC, MAGIC.length + body.length);
        System.arraycopy(body, 0, result, MAGIC.length, body.length);
        return result;
    }
}
