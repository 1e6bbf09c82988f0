// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

/**
 * Converts native values into their wire-safe form for outgoing command arguments.
 *
 * <p>
 * Dispatch order:
 * <ol>
 * <li>{@code null} stays {@code null}</li>
 * <li>{@link Optional} is unwrapped: empty becomes {@code null}, a present value is encoded
 * by these rules</li>
 * <li>{@link String}, {@code byte[]} and {@link Character} pass through unchanged</li>
 * <li>{@link Boolean} becomes {@code "1"} or {@code "0"}</li>
 * <li>{@link LocalDateTime} and {@link Date} become {@code yyyy-MM-ddTHH:mm:ss+hh:mm} in the
 * system default zone</li>
 * <li>{@link Duration} becomes its tick count (100 ns units) as a {@link Long}</li>
 * <li>{@link OffsetDateTime}, {@link ZonedDateTime} and {@link UUID} use {@code toString()}</li>
 * <li>numeric primitive wrappers use {@code toString()}</li>
 * <li>anything else goes to the serializer hook, then to a generic text conversion</li>
 * </ol>
 *
 * <p>
 * The output is therefore one of {@code String}, {@code byte[]}, {@code Character} or
 * {@code Long}. Encoding is deterministic and performs no I/O. The only exceptions are
 * the ones a serializer hook throws, plus {@link ArithmeticException} for a
 * {@link Duration} outside the tick range.
 *
 * <p>
 * <strong>Thread Safety:</strong> instances are immutable and thread-safe.
 */
public final class ValueEncoder {

    private static final Set<Class<?>> NUMERIC_WRAPPERS = Set.of(
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class);

    private final CodecHooks hooks;

    public ValueEncoder(final CodecHooks hooks) {
        this.hooks = Objects.requireNonNull(hooks, "hooks");
    }

    /**
     * Encodes {@code value}.
     *
     * @param value any value
     * @return the wire-safe form, {@code null} for {@code null}
     */
    public @Nullable Object encode(final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? encode(optional.get()) : null;
        }
        if (value instanceof String || value instanceof byte[] || value instanceof Character) {
            return value;
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof LocalDateTime dateTime) {
            return WireFormats.formatDateTime(dateTime);
        }
        if (value instanceof Date date) {
            return WireFormats.formatDateTime(date);
        }
        if (value instanceof Duration duration) {
            return WireFormats.toTicks(duration);
        }
        if (value instanceof OffsetDateTime || value instanceof ZonedDateTime || value instanceof UUID) {
            return value.toString();
        }
        if (NUMERIC_WRAPPERS.contains(value.getClass())) {
            return value.toString();
        }

        final Function<Object, String> serializer = hooks.serializer();
        if (serializer != null) {
            final String serialized = serializer.apply(value);
            if (serialized != null) {
                return serialized;
            }
        }
        return toText(value);
    }

    private static String toText(final Object value) {
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }
}
