// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import org.jspecify.annotations.Nullable;

/**
 * Context passed to {@link Interceptor#before(BeforeContext)}.
 *
 * <p>Setting a value marks it as a substitute for the call's result. Each interceptor gets
 * its own context.
 */
public final class BeforeContext {

    private final FerriteClient client;
    private final Command command;
    private @Nullable Object value;
    private boolean valueChanged;

    BeforeContext(final FerriteClient client, final Command command) {
        this.client = client;
        this.command = command;
    }

    public FerriteClient client() {
        return client;
    }

    public Command command() {
        return command;
    }

    public @Nullable Object value() {
        return value;
    }

    /**
     * Offers a substitute result. Ignored unless it is a non-null instance of the
     * call's result type.
     *
     * @param value the substitute
     */
    public void value(final @Nullable Object value) {
        this.value = value;
        this.valueChanged = true;
    }

    public boolean isValueChanged() {
        return valueChanged;
    }
}
