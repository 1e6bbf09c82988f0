// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

/**
 * Hook around a single call made through a {@link FerriteClient}.
 *
 * <p>
 * A fresh instance is obtained from the registered factory for every call, so an
 * interceptor may keep per-call state (a cache key, a span) between {@link #before} and
 * {@link #after}. Interceptors run in registration order.
 *
 * <p>
 * {@code before} may short-circuit the call by setting a substitute value with
 * {@link BeforeContext#value(Object)}. The substitute is used only when it is an instance
 * of the call's result type; the last interceptor that sets one wins. {@code after} is
 * invoked for every instance whose {@code before} ran, whether the call succeeded, failed
 * or was short-circuited.
 *
 * <pre>{@code
 * client.addInterceptor(() -> new Interceptor() {
 *     public void before(BeforeContext ctx) {
 *         String cached = cache.get(ctx.command().toString());
 *         if (cached != null) {
 *             ctx.value(cached);
 *         }
 *     }
 *
 *     public void after(AfterContext ctx) {
 *         metrics.record(ctx.elapsedMillis(), ctx.exception() != null);
 *     }
 * });
 * }</pre>
 *
 * @see FerriteClient#addInterceptor(java.util.function.Supplier)
 */
public interface Interceptor {

    /**
     * Invoked before the call is executed.
     *
     * @param context the command and the substitute slot
     */
    void before(BeforeContext context);

    /**
     * Invoked after the call completed, failed or was short-circuited.
     *
     * @param context the outcome and this interceptor's elapsed time
     */
    void after(AfterContext context);
}
