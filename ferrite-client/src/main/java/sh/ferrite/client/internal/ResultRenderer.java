// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client.internal;

import java.lang.reflect.Array;

import org.jspecify.annotations.Nullable;

import sh.ferrite.core.InternalApi;

/**
 * Renders call outcomes for notice text.
 *
 * <p>Arrays of any component type render as {@code [e1, e2, e3]}, nested arrays
 * recursively, byte arrays included. {@code null} renders as empty text.
 */
@InternalApi
public final class ResultRenderer {

    private ResultRenderer() {}

    public static String render(final @Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (!value.getClass().isArray()) {
            return value.toString();
        }
        final StringBuilder sb = new StringBuilder();
        appendArray(sb, value);
        return sb.toString();
    }

    private static void appendArray(final StringBuilder sb, final Object array) {
        final int length = Array.getLength(array);
        sb.append('[');
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            final Object element = Array.get(array, i);
            if (element != null && element.getClass().isArray()) {
                appendArray(sb, element);
            } else {
                sb.append(render(element));
            }
        }
        sb.append(']');
    }
}
