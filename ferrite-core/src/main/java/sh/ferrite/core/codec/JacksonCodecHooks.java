// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.ferrite.core.error.ValueConversionException;

/**
 * {@link CodecHooks} that store non-scalar values as JSON.
 *
 * <pre>{@code
 * FerriteClient client = FerriteClient.create(adapter, ClientConfig.builder()
 *         .codecHooks(JacksonCodecHooks.create())
 *         .build());
 * client.call(new CommandPacket("SET").inputKey("user:1").input(client.serializeValue(new User("ada"))));
 * }</pre>
 *
 * <p>Jackson failures surface as {@link ValueConversionException} with the Jackson
 * exception as cause.
 */
public final class JacksonCodecHooks {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JacksonCodecHooks() {
    }

    /**
     * Creates hooks backed by a shared default {@link ObjectMapper}.
     *
     * @return the hooks
     */
    public static CodecHooks create() {
        return create(MAPPER);
    }

    /**
     * Creates hooks backed by {@code mapper}. The mapper must not be reconfigured
     * afterwards.
     *
     * @param mapper the object mapper
     * @return the hooks
     */
    public static CodecHooks create(final ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return CodecHooks.of(
                value -> write(mapper, value),
                (text, type) -> read(mapper, text, type));
    }

    private static String write(final ObjectMapper mapper, final Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValueConversionException(
                    "Unable to serialize " + value.getClass().getName() + " to JSON",
                    value.getClass(),
                    e);
        }
    }

    private static Object read(final ObjectMapper mapper, final String text, final Class<?> type) {
        try {
            return mapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new ValueConversionException(
                    "Unable to deserialize JSON to " + type.getName(),
                    type,
                    e);
        }
    }
}
