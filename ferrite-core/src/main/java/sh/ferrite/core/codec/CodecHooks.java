// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.util.function.BiFunction;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

/**
 * User-supplied conversion functions consulted after every built-in rule.
 *
 * <p>Precedence for both directions is: built-in rule for the type, then the hook,
 * then the generic fallback conversion. Either hook may be {@code null}; a missing hook
 * never causes a failure because the fallback always applies.
 *
 * <p>A serializer returning {@code null} also falls through to the generic conversion.
 * Exceptions thrown by a hook propagate to the caller unchanged.
 *
 * @param serializer   value to text, or {@code null}
 * @param deserializer text and target class to value, or {@code null}; receives the
 *                     target with any optional layer removed
 * @see JacksonCodecHooks
 */
public record CodecHooks(
        @Nullable Function<Object, String> serializer,
        @Nullable BiFunction<String, Class<?>, Object> deserializer) {

    private static final CodecHooks NONE = new CodecHooks(null, null);

    /**
     * Returns hooks that defer everything to the generic conversion.
     *
     * @return the empty hooks
     */
    public static CodecHooks none() {
        return NONE;
    }

    public static CodecHooks of(
            final @Nullable Function<Object, String> serializer,
            final @Nullable BiFunction<String, Class<?>, Object> deserializer) {
        return serializer == null && deserializer == null ? NONE : new CodecHooks(serializer, deserializer);
    }

    public boolean isEmpty() {
        return serializer == null && deserializer == null;
    }
}
