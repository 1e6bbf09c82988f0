// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import org.jspecify.annotations.Nullable;

/**
 * A prepared command, as built by the command layer and sent by an {@link Adapter}.
 *
 * <p>The call pipeline touches a command in three ways: it applies the client's key
 * prefix before execution, reads the host the adapter wrote it to, and renders it with
 * {@link Object#toString()} for notifications. Everything else about the command is
 * opaque to it.
 *
 * <p>A command belongs to a single call and is not shared between threads.
 *
 * @see CommandPacket
 */
public interface Command {

    /**
     * Applies a key prefix to the command's key arguments.
     *
     * <p>Implementations must tolerate a {@code null} or empty prefix (no-op) and
     * repeated invocation (the prefix is applied at most once).
     *
     * @param prefix the key prefix, possibly {@code null}
     */
    void prefix(@Nullable String prefix);

    /**
     * Returns the host the command was written to.
     *
     * @return {@code host:port}, or {@code null} before the adapter connected
     */
    @Nullable String writeHost();

    /**
     * Records the host the command was written to. Called by adapters.
     *
     * @param host {@code host:port}
     */
    void writeHost(@Nullable String host);
}
