// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.error;

/**
 * Exception thrown when a value cannot be converted to or from its wire form.
 *
 * <p>
 * Parse failures of supported scalar types never raise this exception; they decode to
 * the type default instead. It signals a target type that has no conversion at all, or
 * a failure inside the JSON codec hooks.
 */
public final class ValueConversionException extends FerriteException {

    private final Class<?> targetType;

    public ValueConversionException(final String message, final Class<?> targetType) {
        super(message);
        this.targetType = targetType;
    }

    public ValueConversionException(final String message, final Class<?> targetType, final Throwable cause) {
        super(message, cause);
        this.targetType = targetType;
    }

    public static ValueConversionException unsupported(final Class<?> targetType) {
        return new ValueConversionException(
                "No conversion from text to " + targetType.getName()
                        + "; register a TextParser or configure a deserializer hook",
                targetType);
    }

    public Class<?> targetType() {
        return targetType;
    }

    @Override
    public String toString() {
        return "ValueConversionException{"
                + "targetType="
                + targetType.getName()
                + ", message="
                + getMessage()
                + "}";
    }
}
