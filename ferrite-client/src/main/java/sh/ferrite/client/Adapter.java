// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.util.function.Function;

/**
 * Transport behind a {@link FerriteClient}: pooling, cluster routing, sentinel failover
 * or a single connection.
 *
 * <p>
 * The adapter writes the command, reads the reply and hands it to the result parser.
 * It records the host it wrote to with {@link Command#writeHost(String)}. Protocol and
 * transport failures are raised from {@link #adapterCall}; the client's call pipeline
 * observes them and rethrows them unchanged.
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe.
 */
public interface Adapter extends AutoCloseable {

    /**
     * Returns the connection mode of this adapter.
     *
     * @return the mode
     */
    UseType useType();

    /**
     * Executes {@code command} and parses its reply.
     *
     * @param command the prefixed command
     * @param parser  converts the reply, usually via {@link Reply#throwOrValue()}
     * @param <T>     the parsed type
     * @return the parsed value
     */
    <T> T adapterCall(Command command, Function<Reply, T> parser);

    /**
     * Releases connections. Called exactly once by the owning client.
     */
    @Override
    void close();
}
