// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import sh.ferrite.core.error.ValueConversionException;

class JacksonCodecHooksTest {

    private final CodecHooks hooks = JacksonCodecHooks.create();
    private final ValueEncoder encoder = new ValueEncoder(hooks);
    private final ValueDecoder decoder = new ValueDecoder(hooks, TextParsers.builtIn());

    public record Profile(String name, int age) {
    }

    @Test
    void objectsTravelAsJson() {
        final Object wire = encoder.encode(new Profile("ada", 36));

        assertEquals("{\"name\":\"ada\",\"age\":36}", wire);
    }

    @Test
    void jsonDecodesIntoTarget() {
        final byte[] payload = "{\"name\":\"alan\",\"age\":41}".getBytes(StandardCharsets.UTF_8);

        final Optional<Profile> profile = decoder.decode(payload, TypeDescriptor.optionalOf(Profile.class),
                StandardCharsets.UTF_8);

        assertEquals(Optional.of(new Profile("alan", 41)), profile);
    }

    @Test
    void scalarsStillUseBuiltInRules() {
        assertEquals("1", encoder.encode(true));
        assertEquals("5", encoder.encode(5));
        assertEquals(5, decoder.decode("5".getBytes(StandardCharsets.UTF_8), TypeDescriptor.of(int.class),
                StandardCharsets.UTF_8));
    }

    @Test
    void invalidJsonIsWrapped() {
        final byte[] payload = "{not json".getBytes(StandardCharsets.UTF_8);

        final ValueConversionException ex = assertThrows(ValueConversionException.class,
                () -> decoder.decode(payload, TypeDescriptor.of(Profile.class), StandardCharsets.UTF_8));

        assertEquals(Profile.class, ex.targetType());
        assertInstanceOf(JsonProcessingException.class, ex.getCause());
    }
}
