// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.error;

/**
 * Thrown when an operation is not valid for the client's current connection mode,
 * for example a cluster-only command on a pooled client.
 *
 * <p>Raised synchronously, before the command reaches the call pipeline, so no
 * interceptor or notification observes it.
 */
public final class ClientUsageException extends FerriteException {

    public ClientUsageException(final String message) {
        super(message);
    }
}
