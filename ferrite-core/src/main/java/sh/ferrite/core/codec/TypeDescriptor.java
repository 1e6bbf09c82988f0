// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Describes the Java type a reply payload is decoded into.
 *
 * <p>A descriptor is either a plain class ({@link #of(Class)}) or an optional of a class
 * ({@link #optionalOf(Class)}). Decoding unwraps the optional layer, dispatches on the
 * inner class and wraps the result again, so a missing or unparsable value becomes
 * {@link Optional#empty()}.
 *
 * <p>Each descriptor knows its type default, the value returned whenever a payload is
 * absent, empty or malformed:
 * <ul>
 *   <li>primitive classes: {@code false}, {@code '\0'} or zero</li>
 *   <li>optionals: {@link Optional#empty()}</li>
 *   <li>everything else: {@code null}</li>
 * </ul>
 *
 * @param <T> the decoded Java type
 */
public final class TypeDescriptor<T> {

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            boolean.class, Boolean.class,
            char.class, Character.class,
            byte.class, Byte.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
            boolean.class, Boolean.FALSE,
            char.class, '\0',
            byte.class, (byte) 0,
            short.class, (short) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d);

    private final Class<?> targetType;
    private final boolean optional;

    private TypeDescriptor(final Class<?> targetType, final boolean optional) {
        this.targetType = targetType;
        this.optional = optional;
    }

    /**
     * Creates a descriptor for a plain class. Primitive classes are allowed and decode
     * to their boxed values.
     *
     * @param type the target class
     * @param <T>  the target type
     * @return the descriptor
     * @throws IllegalArgumentException if {@code type} is {@link Optional} itself
     */
    public static <T> TypeDescriptor<T> of(final Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (type == Optional.class) {
            throw new IllegalArgumentException("Use TypeDescriptor.optionalOf(...) for optional targets");
        }
        return new TypeDescriptor<>(type, false);
    }

    /**
     * Creates a descriptor for an optional of {@code type}.
     *
     * @param type the inner class
     * @param <T>  the inner type
     * @return the descriptor
     */
    public static <T> TypeDescriptor<Optional<T>> optionalOf(final Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (type == Optional.class) {
            throw new IllegalArgumentException("Nested optionals are not supported");
        }
        return new TypeDescriptor<>(type, true);
    }

    /**
     * Returns the wrapper class for a primitive class, or the class itself.
     *
     * @param type any class
     * @return the boxed class
     */
    public static Class<?> box(final Class<?> type) {
        final Class<?> boxed = BOXES.get(type);
        return boxed != null ? boxed : type;
    }

    /**
     * Returns the class decoding dispatches on, with any optional layer removed.
     *
     * @return the unwrapped target class, possibly primitive
     */
    public Class<?> targetType() {
        return targetType;
    }

    /**
     * Returns {@link #targetType()} with primitives replaced by their wrappers.
     *
     * @return the boxed target class
     */
    public Class<?> boxedType() {
        return box(targetType);
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * Returns the value used for absent, empty or malformed payloads.
     *
     * @return the type default
     */
    @SuppressWarnings("unchecked")
    public @Nullable T defaultValue() {
        if (optional) {
            return (T) Optional.empty();
        }
        return (T) PRIMITIVE_DEFAULTS.get(targetType);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeDescriptor<?> other)) {
            return false;
        }
        return optional == other.optional && targetType == other.targetType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetType, optional);
    }

    @Override
    public String toString() {
        return optional
                ? "Optional<" + targetType.getSimpleName() + ">"
                : targetType.getSimpleName();
    }
}
