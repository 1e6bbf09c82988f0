// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.util.List;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ferrite.client.internal.ResultRenderer;
import sh.ferrite.core.LogSanitizer;
import sh.ferrite.core.codec.TypeDescriptor;

/**
 * Executes one command on behalf of a {@link FerriteClient}.
 *
 * <p>
 * Every call has the key prefix applied. Without interceptors or notice subscribers the
 * call is invoked directly with no timing and no allocation beyond the caller's.
 * Otherwise the call runs through the interceptor chain:
 * <ol>
 * <li>each registered factory produces an {@link Interceptor} whose {@code before} runs
 * in registration order, possibly offering a substitute result;</li>
 * <li>unless a substitute was accepted, the call is invoked exactly once;</li>
 * <li>{@code after} runs for every created interceptor, in the same order, with the
 * outcome and its own elapsed time;</li>
 * <li>if anyone is subscribed, one {@link NoticeType#CALL} notice is published.</li>
 * </ol>
 * A failure of the call (or of a {@code before} hook) is rethrown unchanged after the
 * After and notification stages. Failures of {@code after} hooks are logged and do not
 * change the outcome.
 *
 * <p>
 * <strong>Thread Safety:</strong> thread-safe. Each call snapshots the interceptor list
 * once; registrations made meanwhile apply to later calls.
 */
public final class CallPipeline {

    private static final Logger log = LoggerFactory.getLogger(CallPipeline.class);

    static final String NOT_CONNECTED = "Not connected";

    private final FerriteClient client;
    private final @Nullable String prefix;
    private final List<Supplier<? extends Interceptor>> interceptors;
    private final NotificationSink notifications;

    CallPipeline(
            final FerriteClient client,
            final @Nullable String prefix,
            final List<Supplier<? extends Interceptor>> interceptors,
            final NotificationSink notifications) {
        this.client = client;
        this.prefix = prefix;
        this.interceptors = interceptors;
        this.notifications = notifications;
    }

    /**
     * Runs {@code call} for {@code command}.
     *
     * @param command    the command, prefixed in place
     * @param resultType the expected result class, used to accept substitutes
     * @param call       performs the actual round trip
     * @param <T>        the result type
     * @return the call's result or an interceptor's substitute
     */
    public <T> T execute(final Command command, final Class<T> resultType, final Supplier<T> call) {
        command.prefix(prefix);
        if (interceptors.isEmpty() && !notifications.hasSubscribers()) {
            return call.get();
        }
        return executeIntercepted(command, resultType, call);
    }

    @SuppressWarnings("unchecked")
    private <T> T executeIntercepted(final Command command, final Class<T> resultType, final Supplier<T> call) {
        final boolean notify = notifications.hasSubscribers();
        final long callStart = notify ? System.nanoTime() : 0L;
        final Supplier<?>[] factories = interceptors.toArray(new Supplier<?>[0]);
        final Interceptor[] created = new Interceptor[factories.length];
        final long[] createdAt = new long[factories.length];
        int createdCount = 0;

        T result = null;
        Throwable failure = null;
        try {
            final Class<?> accepted = TypeDescriptor.box(resultType);
            boolean intercepted = false;
            Object substitute = null;
            for (Supplier<?> factory : factories) {
                createdAt[createdCount] = System.nanoTime();
                final Interceptor interceptor = (Interceptor) factory.get();
                if (interceptor == null) {
                    throw new IllegalStateException("Interceptor factory returned null: " + factory);
                }
                created[createdCount++] = interceptor;
                final BeforeContext context = new BeforeContext(client, command);
                interceptor.before(context);
                if (context.isValueChanged() && accepted.isInstance(context.value())) {
                    substitute = context.value();
                    intercepted = true;
                }
            }
            result = intercepted ? (T) substitute : call.get();
            return result;
        } catch (Throwable e) {
            failure = e;
            throw e;
        } finally {
            runAfter(command, created, createdAt, createdCount, result, failure);
            if (notify) {
                final long elapsedMillis = (System.nanoTime() - callStart) / 1_000_000L;
                notifications.publish(Notice.call(failure, describe(command, elapsedMillis, result, failure), result));
            }
        }
    }

    private void runAfter(
            final Command command,
            final Interceptor[] created,
            final long[] createdAt,
            final int count,
            final @Nullable Object result,
            final @Nullable Throwable failure) {
        for (int i = 0; i < count; i++) {
            final long elapsedMillis = (System.nanoTime() - createdAt[i]) / 1_000_000L;
            try {
                created[i].after(new AfterContext(client, command, result, failure, elapsedMillis));
            } catch (RuntimeException e) {
                log.error("Interceptor {} failed after {}",
                        created[i].getClass().getName(), LogSanitizer.sanitize(String.valueOf(command)), e);
            }
        }
    }

    static String describe(
            final Command command,
            final long elapsedMillis,
            final @Nullable Object result,
            final @Nullable Throwable failure) {
        final String host = command.writeHost();
        final String outcome = failure != null ? failureText(failure) : ResultRenderer.render(result);
        return (host == null ? NOT_CONNECTED : host)
                + " (" + elapsedMillis + "ms) > " + command + "\r\n" + outcome;
    }

    private static String failureText(final Throwable failure) {
        final String message = failure.getMessage();
        return message != null ? message : failure.toString();
    }
}
