// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.error;

/**
 * Base runtime exception for all Ferrite failures.
 *
 * <p>
 * This sealed class forms the root of Ferrite's exception hierarchy, so every
 * Ferrite-specific error can be caught with a single catch clause.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * FerriteException
 * ├── {@link ClientUsageException} - operation invalid for the client's connection mode
 * ├── {@link ServerReplyException} - the server answered with an error reply
 * └── {@link ValueConversionException} - a payload has no viable conversion to the target type
 * </pre>
 *
 * <p>
 * Failures raised by the transport itself, and exceptions thrown by user-supplied
 * codec hooks, are not wrapped: the call pipeline rethrows them unchanged.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.call(command);
 * } catch (ServerReplyException e) {
 *     // WRONGTYPE, NOSCRIPT, ...
 * } catch (FerriteException e) {
 *     // any other Ferrite error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class FerriteException extends RuntimeException
        permits ClientUsageException,
        ServerReplyException,
        ValueConversionException {

    public FerriteException(final String message) {
        super(message);
    }

    public FerriteException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
