// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

/**
 * Handle returned by {@link NotificationSink#subscribe(NoticeListener)}.
 */
public interface Subscription {

    /** Removes the listener. Idempotent. */
    void unsubscribe();

    /** Returns whether the listener is still registered. */
    boolean isActive();
}
