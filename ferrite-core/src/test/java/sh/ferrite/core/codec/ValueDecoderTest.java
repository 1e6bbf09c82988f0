// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import sh.ferrite.core.error.ValueConversionException;

class ValueDecoderTest {

    private static final Charset UTF8 = StandardCharsets.UTF_8;

    private final ValueDecoder decoder = new ValueDecoder(CodecHooks.none(), TextParsers.builtIn());
    private final ValueEncoder encoder = new ValueEncoder(CodecHooks.none());

    private <T> T decode(final String text, final TypeDescriptor<T> type) {
        return decoder.decode(text.getBytes(UTF8), type, UTF8);
    }

    private <T> T decode(final String text, final Class<T> type) {
        return decode(text, TypeDescriptor.of(type));
    }

    // ==================== Raw targets ====================

    @Test
    void byteArrayTargetReturnsPayload() {
        final byte[] payload = {0, 1, (byte) 0xFF};

        assertSame(payload, decoder.decode(payload, TypeDescriptor.of(byte[].class), UTF8));
    }

    @Test
    void stringTargetHonoursCharset() {
        final byte[] latin1 = "café".getBytes(StandardCharsets.ISO_8859_1);

        assertEquals("café", decoder.decode(latin1, TypeDescriptor.of(String.class), StandardCharsets.ISO_8859_1));
    }

    @Test
    void emptyPayloadForStringIsEmptyString() {
        assertEquals("", decoder.decode(new byte[0], TypeDescriptor.of(String.class), UTF8));
    }

    @Test
    void booleanArrayTargetReadsOneFlagPerByte() {
        final boolean[] flags = decode("1021", boolean[].class);

        assertArrayEquals(new boolean[] {true, false, false, true}, flags);
    }

    // ==================== Defaults ====================

    @Test
    void nullPayloadYieldsTypeDefaults() {
        assertNull(decoder.decode(null, TypeDescriptor.of(String.class), UTF8));
        assertNull(decoder.decode(null, TypeDescriptor.of(Integer.class), UTF8));
        assertEquals(0, decoder.decode(null, TypeDescriptor.of(int.class), UTF8));
        assertEquals(false, decoder.decode(null, TypeDescriptor.of(boolean.class), UTF8));
        assertEquals('\0', decoder.decode(null, TypeDescriptor.of(char.class), UTF8));
        assertEquals(Optional.empty(), decoder.decode(null, TypeDescriptor.optionalOf(Long.class), UTF8));
    }

    @Test
    void emptyTextYieldsTypeDefaults() {
        assertEquals(0L, decode("", long.class));
        assertEquals(0d, decode("", double.class));
        assertNull(decode("", UUID.class));
        assertNull(decode("", Duration.class));
        assertEquals(Optional.empty(), decode("", TypeDescriptor.optionalOf(Integer.class)));
    }

    @Test
    void emptyTextForBooleanIsFalseLikeNull() {
        assertEquals(false, decode("", boolean.class));
        assertEquals(decoder.decode(null, TypeDescriptor.of(boolean.class), UTF8), decode("", boolean.class));
    }

    @Test
    void malformedTextYieldsDefaultsWithoutThrowing() {
        assertEquals(0, decode("abc", int.class));
        assertNull(decode("abc", Integer.class));
        assertEquals(0L, decode("12.5", long.class));
        assertEquals(0d, decode("one", double.class));
        assertNull(decode("not-a-uuid", UUID.class));
        assertNull(decode("yesterday", OffsetDateTime.class));
        assertNull(decode("1.5", Duration.class));
        assertEquals(Optional.empty(), decode("x", TypeDescriptor.optionalOf(Short.class)));
        assertEquals(false, decode("true", boolean.class));
    }

    // ==================== Scalars ====================

    @Test
    void booleanIsTrueOnlyForOne() {
        assertEquals(true, decode("1", boolean.class));
        assertEquals(false, decode("0", boolean.class));
        assertEquals(Boolean.TRUE, decode("1", Boolean.class));
        assertEquals(Optional.of(false), decode("0", TypeDescriptor.optionalOf(Boolean.class)));
    }

    @Test
    void characterIsFirstCharacter() {
        assertEquals('a', decode("abc", char.class));
        assertEquals('z', decode("z", Character.class));
    }

    @Test
    void durationFromTicks() {
        assertEquals(Duration.ofSeconds(1), decode("10000000", Duration.class));
        assertEquals(Duration.ofMillis(-500), decode("-5000000", Duration.class));
    }

    @Test
    void registeredParsersHandleNumbersAndIdentifiers() {
        assertEquals(42, decode("42", int.class));
        assertEquals(Optional.of(7L), decode("7", TypeDescriptor.optionalOf(long.class)));
        assertEquals(new BigDecimal("3.14"), decode("3.14", BigDecimal.class));
        assertEquals(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"),
                decode("123e4567-e89b-12d3-a456-426614174000", UUID.class));
        assertEquals(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(8)),
                decode("2024-01-02T03:04:05+08:00", OffsetDateTime.class));
    }

    @Test
    void customParserTakesPrecedenceOverHook() {
        final ValueDecoder custom = new ValueDecoder(
                CodecHooks.of(null, (text, type) -> {
                    throw new AssertionError("hook must not be reached");
                }),
                TextParsers.builder()
                        .register(Point.class, TextParser.lenient(Point::parse))
                        .build());

        assertEquals(new Point(1, 2), custom.decode("1,2".getBytes(UTF8), TypeDescriptor.of(Point.class), UTF8));
        assertNull(custom.decode("1;2".getBytes(UTF8), TypeDescriptor.of(Point.class), UTF8));
    }

    // ==================== Round trips ====================

    @Test
    void encodedScalarsDecodeToTheSameValue() {
        assertRoundTrip("plain text", String.class);
        assertRoundTrip(true, Boolean.class);
        assertRoundTrip(false, Boolean.class);
        assertRoundTrip(123456, Integer.class);
        assertRoundTrip(Long.MIN_VALUE, Long.class);
        assertRoundTrip((short) -12, Short.class);
        assertRoundTrip((byte) 127, Byte.class);
        assertRoundTrip(0.1d, Double.class);
        assertRoundTrip(-2.5f, Float.class);
        assertRoundTrip('q', Character.class);
        assertRoundTrip(Duration.ofMillis(1234), Duration.class);
        assertRoundTrip(Duration.ofSeconds(-90, 300), Duration.class);
        assertRoundTrip(LocalDateTime.of(2023, 6, 15, 12, 30, 45), LocalDateTime.class);
        assertRoundTrip(UUID.randomUUID(), UUID.class);
    }

    @Test
    void encodedOptionalsDecodeThroughOptionalDescriptors() {
        final Object present = encoder.encode(Optional.of(5));
        final Object empty = encoder.encode(Optional.empty());

        assertEquals("5", present);
        assertNull(empty);
        assertEquals(Optional.of(5),
                decoder.decode(String.valueOf(present).getBytes(UTF8), TypeDescriptor.optionalOf(Integer.class), UTF8));
        assertEquals(Optional.empty(), decoder.decode(null, TypeDescriptor.optionalOf(Integer.class), UTF8));
    }

    private <T> void assertRoundTrip(final T value, final Class<T> type) {
        final Object wire = encoder.encode(value);
        final byte[] payload = wire instanceof byte[] bytes ? bytes : String.valueOf(wire).getBytes(UTF8);

        assertEquals(value, decoder.decode(payload, TypeDescriptor.of(type), UTF8), "round trip of " + type.getSimpleName());
    }

    // ==================== Hooks and generic conversion ====================

    enum Level { LOW, HIGH }

    @Test
    void genericConversionResolvesEnumsByName() {
        assertEquals(Level.HIGH, decode("HIGH", Level.class));
        assertEquals("anything", decode("anything", Object.class));
    }

    @Test
    void unknownEnumConstantIsAHardError() {
        final ValueConversionException ex = assertThrows(ValueConversionException.class,
                () -> decode("MEDIUM", Level.class));
        assertEquals(Level.class, ex.targetType());
    }

    @Test
    void typeWithoutConversionIsAHardError() {
        final ValueConversionException ex = assertThrows(ValueConversionException.class,
                () -> decode("[1,2]", List.class));
        assertTrue(ex.getMessage().contains("java.util.List"));
    }

    @Test
    void deserializerHookReceivesUnwrappedTarget() {
        final ValueDecoder hooked = new ValueDecoder(
                CodecHooks.of(null, (text, type) -> {
                    assertEquals(Point.class, type);
                    return Point.parse(text);
                }),
                TextParsers.builtIn());

        final Optional<Point> point = hooked.decode("3,4".getBytes(UTF8), TypeDescriptor.optionalOf(Point.class), UTF8);

        assertEquals(Optional.of(new Point(3, 4)), point);
    }

    @Test
    void deserializerHookExceptionPropagatesUnchanged() {
        final IllegalStateException failure = new IllegalStateException("bad json");
        final ValueDecoder hooked = new ValueDecoder(
                CodecHooks.of(null, (text, type) -> {
                    throw failure;
                }),
                TextParsers.builtIn());

        final IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> hooked.decode("{}".getBytes(UTF8), TypeDescriptor.of(Point.class), UTF8));
        assertSame(failure, thrown);
    }

    @Test
    void hookReturningNullYieldsDefault() {
        final ValueDecoder hooked = new ValueDecoder(CodecHooks.of(null, (text, type) -> null), TextParsers.builtIn());

        assertFalse(hooked.decode("x".getBytes(UTF8), TypeDescriptor.optionalOf(Point.class), UTF8).isPresent());
    }

    record Point(int x, int y) {
        static Point parse(final String text) {
            final String[] parts = text.split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Not a point: " + text);
            }
            return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        }
    }
}
