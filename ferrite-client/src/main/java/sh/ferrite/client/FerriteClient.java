// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.lang.ref.Cleaner;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ferrite.core.codec.TypeDescriptor;
import sh.ferrite.core.codec.ValueDecoder;
import sh.ferrite.core.codec.ValueEncoder;
import sh.ferrite.core.error.ClientUsageException;

/**
 * Entry point for executing commands against a key-value server.
 *
 * <p>
 * A client owns one {@link Adapter} and routes every command through a
 * {@link CallPipeline}, which applies the key prefix, runs the registered
 * {@link Interceptor}s and publishes {@link Notice}s to the client's
 * {@link NotificationSink}. Command families are built on top of
 * {@link #call(Command, Class, Function)} by subclasses, which use
 * {@link #serializeValue(Object)} and {@link #deserializeValue(byte[], TypeDescriptor)}
 * to move typed values across the wire.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (FerriteClient client = FerriteClient.create(adapter, ClientConfig.parse("127.0.0.1:6379,prefix=app:"))) {
 *     client.notifications().subscribe(new Slf4jNoticeListener());
 *     client.call(new CommandPacket("SET").inputKey("greeting").input(client.serializeValue("hello")));
 *     String greeting = client.call(new CommandPacket("GET").inputKey("greeting"), String.class,
 *             reply -> client.deserializeValue((byte[]) reply.throwOrValue(), String.class));
 * }
 * }</pre>
 *
 * <p>
 * <strong>Lifecycle:</strong> {@link #close()} releases the adapter exactly once, however
 * many times and from however many threads it is called, and never throws. Calls made
 * after close fail with {@link IllegalStateException}. A client that becomes unreachable
 * without being closed has its adapter released by a {@link Cleaner}; that is a safety net
 * and not a substitute for closing.
 *
 * <p>
 * <strong>Thread Safety:</strong> thread-safe.
 */
public class FerriteClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FerriteClient.class);

    private static final Cleaner CLEANER = Cleaner.create();

    private final Adapter adapter;
    private final ClientConfig config;
    private final ValueEncoder encoder;
    private final ValueDecoder decoder;
    private final NotificationSink notifications = new NotificationSink();
    private final CopyOnWriteArrayList<Supplier<? extends Interceptor>> interceptors = new CopyOnWriteArrayList<>();
    private final CallPipeline pipeline;
    private final Disposer disposer;
    private final Cleaner.Cleanable cleanable;

    protected FerriteClient(final Adapter adapter, final ClientConfig config) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = new ValueEncoder(config.codecHooks());
        this.decoder = new ValueDecoder(config.codecHooks(), config.textParsers());
        this.pipeline = new CallPipeline(this, config.prefix(), interceptors, notifications);
        this.disposer = new Disposer(adapter);
        this.cleanable = CLEANER.register(this, disposer);
    }

    public static FerriteClient create(final Adapter adapter) {
        return new FerriteClient(adapter, ClientConfig.defaults());
    }

    public static FerriteClient create(final Adapter adapter, final ClientConfig config) {
        return new FerriteClient(adapter, config);
    }

    // ==================== Calls ====================

    /**
     * Executes a command and returns its raw reply value.
     *
     * @param command the command
     * @return the reply value
     * @throws sh.ferrite.core.error.ServerReplyException if the server replied with an error
     * @throws IllegalStateException                      if the client is closed
     */
    public @Nullable Object call(final Command command) {
        return call(command, Object.class, Reply::throwOrValue);
    }

    /**
     * Executes a command and parses its reply.
     *
     * <p>Interceptors may answer the call with a substitute of type {@code resultType}, in
     * which case neither the adapter nor {@code parser} is invoked.
     *
     * @param command    the command
     * @param resultType the class of the parsed result
     * @param parser     converts the reply
     * @param <T>        the result type
     * @return the parsed result or a substitute
     * @throws IllegalStateException if the client is closed
     */
    public <T> T call(final Command command, final Class<T> resultType, final Function<Reply, T> parser) {
        Objects.requireNonNull(command, "command");
        ensureOpen();
        return pipeline.execute(command, resultType, () -> adapter.adapterCall(command, parser));
    }

    // ==================== Values ====================

    /**
     * Converts a value into its wire form.
     *
     * @param value the value
     * @return a {@code String}, {@code byte[]}, {@code Character}, {@code Long} or {@code null}
     */
    public @Nullable Object serializeValue(final @Nullable Object value) {
        return encoder.encode(value);
    }

    /**
     * Decodes a reply payload using the configured charset.
     *
     * @param payload the raw payload, possibly {@code null}
     * @param type    the target type
     * @param <T>     the target type
     * @return the decoded value, or the type's default for empty or malformed payloads
     */
    public <T> T deserializeValue(final byte @Nullable [] payload, final TypeDescriptor<T> type) {
        return decoder.decode(payload, type, config.charset());
    }

    public <T> T deserializeValue(final byte @Nullable [] payload, final Class<T> type) {
        return deserializeValue(payload, TypeDescriptor.of(type));
    }

    // ==================== Interceptors and notices ====================

    /**
     * Registers an interceptor factory. The factory is invoked once per call.
     *
     * @param factory produces a fresh interceptor
     */
    public void addInterceptor(final Supplier<? extends Interceptor> factory) {
        interceptors.add(Objects.requireNonNull(factory, "factory"));
    }

    public boolean removeInterceptor(final Supplier<? extends Interceptor> factory) {
        return interceptors.remove(factory);
    }

    public NotificationSink notifications() {
        return notifications;
    }

    /**
     * Publishes a notice to this client's subscribers. Used by adapters for
     * {@link NoticeType#INFO} notices.
     *
     * @param notice the notice
     * @return {@code true} if anyone was subscribed
     */
    public boolean onNotice(final Notice notice) {
        return notifications.publish(notice);
    }

    // ==================== Configuration ====================

    public ClientConfig config() {
        return config;
    }

    public @Nullable String prefix() {
        return config.prefix();
    }

    public UseType useType() {
        return adapter.useType();
    }

    /**
     * Rejects a command that the adapter's mode does not support.
     *
     * @param allowed modes in which the calling method can be used
     * @throws ClientUsageException if the adapter runs in none of them
     */
    protected final void checkUseTypeOrThrow(final UseType... allowed) {
        final UseType current = adapter.useType();
        if (Arrays.asList(allowed).contains(current)) {
            return;
        }
        throw new ClientUsageException("Method cannot be used in " + current + " mode.");
    }

    CallPipeline pipeline() {
        return pipeline;
    }

    // ==================== Lifecycle ====================

    public boolean isClosed() {
        return disposer.isDone();
    }

    /**
     * Releases the adapter. Idempotent and thread-safe; never throws.
     */
    @Override
    public void close() {
        cleanable.clean();
    }

    private void ensureOpen() {
        if (disposer.isDone()) {
            throw new IllegalStateException("Client is closed");
        }
    }

    /**
     * Closes the adapter once. Holds no reference to the client so that the
     * {@link Cleaner} can run it after the client became unreachable.
     */
    private static final class Disposer implements Runnable {

        private final Adapter adapter;
        private final AtomicInteger disposed = new AtomicInteger();

        Disposer(final Adapter adapter) {
            this.adapter = adapter;
        }

        boolean isDone() {
            return disposed.get() != 0;
        }

        @Override
        public void run() {
            if (disposed.incrementAndGet() != 1) {
                return;
            }
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("Error closing adapter {}", adapter.getClass().getName(), e);
            }
        }
    }
}
