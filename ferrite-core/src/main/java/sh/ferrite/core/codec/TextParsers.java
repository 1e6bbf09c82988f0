// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * Immutable registry mapping a target class to its {@link TextParser}.
 *
 * <p>The built-in registry covers every primitive (under both the primitive and the
 * wrapper class), {@link BigInteger}, {@link BigDecimal}, {@link UUID}, {@link Instant},
 * {@link LocalDate}, {@link LocalDateTime}, {@link OffsetDateTime}, {@link ZonedDateTime}
 * and {@link Date}. {@link LocalDateTime} and {@link Date} accept the wire format written
 * by {@link ValueEncoder} as well as ISO local date-times.
 *
 * <pre>{@code
 * TextParsers parsers = TextParsers.builder()
 *         .register(Money.class, TextParser.lenient(Money::parse))
 *         .build();
 * }</pre>
 *
 * <p>Boolean, character and {@link java.time.Duration} targets are decoded by fixed
 * rules in {@link ValueDecoder} and never reach the registry.
 */
public final class TextParsers {

    private static final TextParsers BUILT_IN = new Builder(Map.of())
            .primitive(byte.class, Byte.class, TextParser.lenient(Byte::valueOf))
            .primitive(short.class, Short.class, TextParser.lenient(Short::valueOf))
            .primitive(int.class, Integer.class, TextParser.lenient(Integer::valueOf))
            .primitive(long.class, Long.class, TextParser.lenient(Long::valueOf))
            .primitive(float.class, Float.class, TextParser.lenient(Float::valueOf))
            .primitive(double.class, Double.class, TextParser.lenient(Double::valueOf))
            .register(BigInteger.class, TextParser.lenient(BigInteger::new))
            .register(BigDecimal.class, TextParser.lenient(BigDecimal::new))
            .register(UUID.class, TextParser.lenient(UUID::fromString))
            .register(Instant.class, TextParser.lenient(Instant::parse))
            .register(LocalDate.class, TextParser.lenient(LocalDate::parse))
            .register(LocalDateTime.class, TextParser.lenient(WireFormats::parseLocalDateTime))
            .register(OffsetDateTime.class, TextParser.lenient(OffsetDateTime::parse))
            .register(ZonedDateTime.class, TextParser.lenient(ZonedDateTime::parse))
            .register(Date.class, TextParser.lenient(WireFormats::parseDate))
            .build();

    private final Map<Class<?>, TextParser<?>> parsers;

    private TextParsers(final Map<Class<?>, TextParser<?>> parsers) {
        this.parsers = Map.copyOf(parsers);
    }

    /**
     * Returns the registry of built-in parsers.
     *
     * @return the shared built-in registry
     */
    public static TextParsers builtIn() {
        return BUILT_IN;
    }

    /**
     * Returns a builder pre-populated with the built-in parsers.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder(BUILT_IN.parsers);
    }

    /**
     * Looks up the parser for {@code type}.
     *
     * @param type the target class
     * @param <T>  the target type
     * @return the parser, or {@code null} if none is registered
     */
    @SuppressWarnings("unchecked")
    public <T> @Nullable TextParser<T> find(final Class<T> type) {
        return (TextParser<T>) parsers.get(type);
    }

    public boolean supports(final Class<?> type) {
        return parsers.containsKey(type);
    }

    public static final class Builder {
        private final Map<Class<?>, TextParser<?>> parsers;

        private Builder(final Map<Class<?>, TextParser<?>> initial) {
            this.parsers = new LinkedHashMap<>(initial);
        }

        /**
         * Registers or replaces the parser for {@code type}.
         *
         * @param type   the target class
         * @param parser the parser
         * @param <T>    the target type
         * @return this builder
         */
        public <T> Builder register(final Class<T> type, final TextParser<? extends T> parser) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(parser, "parser");
            parsers.put(type, parser);
            return this;
        }

        private <T> Builder primitive(final Class<T> primitive, final Class<T> wrapper,
                final TextParser<T> parser) {
            parsers.put(primitive, parser);
            parsers.put(wrapper, parser);
            return this;
        }

        public TextParsers build() {
            return new TextParsers(parsers);
        }
    }
}
