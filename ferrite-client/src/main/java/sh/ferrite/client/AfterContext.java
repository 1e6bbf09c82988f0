// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import org.jspecify.annotations.Nullable;

/**
 * Context passed to {@link Interceptor#after(AfterContext)}.
 *
 * @param client        the client that made the call
 * @param command       the prefixed command
 * @param value         the result or substitute, {@code null} on failure
 * @param exception     the failure, or {@code null}
 * @param elapsedMillis milliseconds since this interceptor was created
 */
public record AfterContext(
        FerriteClient client,
        Command command,
        @Nullable Object value,
        @Nullable Throwable exception,
        long elapsedMillis) {
}
