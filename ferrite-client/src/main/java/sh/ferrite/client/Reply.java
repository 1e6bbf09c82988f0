// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import org.jspecify.annotations.Nullable;

import sh.ferrite.core.error.ServerReplyException;

/**
 * A parsed server reply as handed by an {@link Adapter} to a result parser.
 *
 * <p>Exactly one of {@code value} and {@code error} is meaningful: an error reply carries
 * the server's error text, a regular reply its value (which may itself be {@code null}
 * for a nil reply).
 *
 * @param value the reply value when not an error
 * @param error the error text, or {@code null}
 */
public record Reply(@Nullable Object value, @Nullable String error) {

    public static Reply of(final @Nullable Object value) {
        return new Reply(value, null);
    }

    public static Reply error(final String message) {
        return new Reply(null, message);
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Returns the value, or throws for an error reply.
     *
     * @return the reply value
     * @throws ServerReplyException if this is an error reply
     */
    public @Nullable Object throwOrValue() {
        if (error != null) {
            throw new ServerReplyException(error);
        }
        return value;
    }
}
