// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.error;

/**
 * Exception thrown when the server answers a command with an error reply.
 *
 * <p>
 * The message is the raw error text. By convention its first word is an error
 * prefix such as {@code ERR}, {@code WRONGTYPE} or {@code MOVED}; {@link #prefix()}
 * exposes it for typed handling.
 */
public final class ServerReplyException extends FerriteException {

    public ServerReplyException(final String message) {
        super(message);
    }

    /**
     * Returns the leading error word of the reply, e.g. {@code WRONGTYPE}.
     *
     * @return the prefix, or an empty string when the message is blank
     */
    public String prefix() {
        final String msg = getMessage();
        if (msg == null || msg.isBlank()) {
            return "";
        }
        final String trimmed = msg.strip();
        final int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    public boolean isWrongType() {
        return "WRONGTYPE".equals(prefix());
    }

    public boolean isNoScript() {
        return "NOSCRIPT".equals(prefix());
    }
}
