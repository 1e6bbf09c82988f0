// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multicast point for the notices of one client.
 *
 * <p>
 * Listeners are invoked synchronously on the publishing thread, in registration order.
 * A listener that throws is logged and does not prevent delivery to the others.
 * Subscribing and unsubscribing are safe from any thread, including from inside a
 * listener.
 *
 * <pre>{@code
 * Subscription sub = client.notifications().subscribe(new Slf4jNoticeListener());
 * // ...
 * sub.unsubscribe();
 * }</pre>
 */
public final class NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(NotificationSink.class);

    private final CopyOnWriteArrayList<NoticeListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener.
     *
     * @param listener the listener
     * @return a handle that removes it
     */
    public Subscription subscribe(final NoticeListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                listeners.remove(listener);
            }

            @Override
            public boolean isActive() {
                return listeners.contains(listener);
            }
        };
    }

    /**
     * Removes a listener.
     *
     * @param listener the listener
     * @return {@code true} if it was registered
     */
    public boolean unsubscribe(final NoticeListener listener) {
        return listeners.remove(listener);
    }

    public boolean hasSubscribers() {
        return !listeners.isEmpty();
    }

    /**
     * Delivers a notice to every listener.
     *
     * @param notice the notice
     * @return {@code true} if at least one listener was registered
     */
    public boolean publish(final Notice notice) {
        if (listeners.isEmpty()) {
            return false;
        }
        for (NoticeListener listener : listeners) {
            try {
                listener.onNotice(notice);
            } catch (RuntimeException e) {
                log.error("Notice listener {} failed for {} notice", listener, notice.type(), e);
            }
        }
        return true;
    }
}
