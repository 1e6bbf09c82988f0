// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Plain {@link Command}: a command name followed by its arguments, some of which are keys.
 *
 * <pre>{@code
 * Command set = new CommandPacket("SET").inputKey("user:1").input(client.serializeValue(user));
 * }</pre>
 *
 * <p>Arguments are expected to be wire-safe already (see
 * {@link FerriteClient#serializeValue(Object)}). The key prefix is applied to key
 * arguments only, once. {@link #toString()} renders {@code NAME arg1 arg2 ...}, byte
 * arrays as UTF-8 text.
 *
 * <p><strong>Thread Safety:</strong> not thread-safe; a packet belongs to one call.
 */
public final class CommandPacket implements Command {

    private final String name;
    private final List<@Nullable Object> arguments = new ArrayList<>();
    private final List<Integer> keyPositions = new ArrayList<>();
    private boolean prefixed;
    private @Nullable String writeHost;

    public CommandPacket(final String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Appends plain arguments.
     *
     * @param values wire-safe values
     * @return this packet
     */
    public CommandPacket input(final @Nullable Object... values) {
        if (values != null) {
            Collections.addAll(arguments, values);
        }
        return this;
    }

    /**
     * Appends key arguments, which receive the client's key prefix.
     *
     * @param keys the keys
     * @return this packet
     */
    public CommandPacket inputKey(final String... keys) {
        for (String key : keys) {
            keyPositions.add(arguments.size());
            arguments.add(Objects.requireNonNull(key, "key"));
        }
        return this;
    }

    public String name() {
        return name;
    }

    public List<@Nullable Object> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public void prefix(final @Nullable String prefix) {
        if (prefix == null || prefix.isEmpty() || prefixed) {
            return;
        }
        for (int position : keyPositions) {
            arguments.set(position, prefix + arguments.get(position));
        }
        prefixed = true;
    }

    @Override
    public @Nullable String writeHost() {
        return writeHost;
    }

    @Override
    public void writeHost(final @Nullable String host) {
        this.writeHost = host;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(name);
        for (Object argument : arguments) {
            sb.append(' ');
            if (argument instanceof byte[] bytes) {
                sb.append(new String(bytes, StandardCharsets.UTF_8));
            } else {
                sb.append(argument);
            }
        }
        return sb.toString();
    }
}
