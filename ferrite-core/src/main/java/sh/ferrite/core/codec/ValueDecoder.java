// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

import org.jspecify.annotations.Nullable;

import sh.ferrite.core.error.ValueConversionException;

/**
 * Converts reply payloads into native values.
 *
 * <p>
 * Decoding is soft: a {@code null} payload, an empty text or text that does not parse
 * as the target type all produce the type default ({@link TypeDescriptor#defaultValue()})
 * instead of an exception.
 *
 * <p>
 * Dispatch order, on the target class with any optional layer removed:
 * <ol>
 * <li>{@code byte[]}: the payload itself</li>
 * <li>{@link String}: the payload decoded with the given charset</li>
 * <li>{@code boolean[]}: one flag per payload byte, {@code true} for {@code '1'}</li>
 * <li>otherwise the decoded text; empty text yields the default</li>
 * <li>{@code boolean}/{@link Boolean}: text equals {@code "1"}</li>
 * <li>{@code char}/{@link Character}: first character</li>
 * <li>{@link Duration}: tick count (100 ns units)</li>
 * <li>a {@link TextParser} registered in {@link TextParsers}</li>
 * <li>the deserializer hook, then the generic conversion</li>
 * </ol>
 *
 * <p>
 * The generic conversion handles {@link Object}, {@link CharSequence} and enum targets.
 * Any other target, or an unknown enum constant, raises
 * {@link ValueConversionException}: a type with no conversion is a programming error,
 * not malformed input. Deserializer hook exceptions propagate unchanged.
 *
 * <p>
 * <strong>Thread Safety:</strong> instances are immutable and thread-safe.
 */
public final class ValueDecoder {

    private static final byte FLAG_SET = '1';

    private final CodecHooks hooks;
    private final TextParsers parsers;

    public ValueDecoder(final CodecHooks hooks, final TextParsers parsers) {
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.parsers = Objects.requireNonNull(parsers, "parsers");
    }

    /**
     * Decodes {@code payload} into {@code type}.
     *
     * @param payload the raw reply bytes, possibly {@code null}
     * @param type    the target type
     * @param charset the text encoding of the payload
     * @param <T>     the target type
     * @return the decoded value, or the type default
     * @throws ValueConversionException if the target type has no conversion
     */
    public <T> T decode(final byte @Nullable [] payload, final TypeDescriptor<T> type, final Charset charset) {
        if (payload == null) {
            return type.defaultValue();
        }

        final Class<?> target = type.targetType();
        final Object raw = decodeRaw(payload, target, charset);
        if (raw != null) {
            return wrap(type, raw);
        }

        final String text = new String(payload, charset);
        if (text.isEmpty()) {
            return type.defaultValue();
        }

        final Object value = decodeText(text, target);
        if (value == null) {
            return type.defaultValue();
        }
        return wrap(type, type.boxedType().cast(value));
    }

    private static @Nullable Object decodeRaw(final byte[] payload, final Class<?> target, final Charset charset) {
        if (target == byte[].class) {
            return payload;
        }
        if (target == String.class) {
            return new String(payload, charset);
        }
        if (target == boolean[].class) {
            final boolean[] flags = new boolean[payload.length];
            for (int i = 0; i < payload.length; i++) {
                flags[i] = payload[i] == FLAG_SET;
            }
            return flags;
        }
        return null;
    }

    private @Nullable Object decodeText(final String text, final Class<?> target) {
        if (target == boolean.class || target == Boolean.class) {
            return "1".equals(text);
        }
        if (target == char.class || target == Character.class) {
            return text.charAt(0);
        }
        if (target == Duration.class) {
            try {
                return WireFormats.fromTicks(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return null;
            }
        }

        final TextParser<?> parser = parsers.find(target);
        if (parser != null) {
            return parser.tryParse(text).orElse(null);
        }

        final BiFunction<String, Class<?>, Object> deserializer = hooks.deserializer();
        if (deserializer != null) {
            return deserializer.apply(text, target);
        }
        return convert(text, target);
    }

    private static Object convert(final String text, final Class<?> target) {
        if (target == Object.class || target == CharSequence.class) {
            return text;
        }
        if (target.isEnum()) {
            for (Object constant : target.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(text)) {
                    return constant;
                }
            }
            throw new ValueConversionException(
                    "No enum constant " + target.getName() + "." + text, target);
        }
        throw ValueConversionException.unsupported(target);
    }

    @SuppressWarnings("unchecked")
    private static <T> T wrap(final TypeDescriptor<T> type, final Object value) {
        return type.isOptional() ? (T) Optional.of(value) : (T) value;
    }
}
