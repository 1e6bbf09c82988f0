// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A diagnostic event published through a {@link NotificationSink}.
 *
 * <p>For {@link NoticeType#CALL} notices, {@code log} is
 * {@code <host> (<ms>ms) > <command>\r\n<outcome>} and {@code tag} is the call's result.
 *
 * @param type      the kind of notice
 * @param exception the call failure, or {@code null}
 * @param log       the rendered text
 * @param tag       the result for successful call notices, otherwise {@code null}
 */
public record Notice(
        NoticeType type,
        @Nullable Throwable exception,
        String log,
        @Nullable Object tag) {

    public Notice {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(log, "log");
    }

    public static Notice call(final @Nullable Throwable exception, final String log, final @Nullable Object result) {
        return new Notice(NoticeType.CALL, exception, log, result);
    }

    public static Notice info(final String log) {
        return new Notice(NoticeType.INFO, null, log, null);
    }
}
