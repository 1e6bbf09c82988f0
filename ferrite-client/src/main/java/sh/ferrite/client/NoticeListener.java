// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

/**
 * Receives notices published by a client.
 *
 * <p>Listeners run synchronously on the calling thread and should return quickly.
 */
@FunctionalInterface
public interface NoticeListener {

    void onNotice(Notice notice);
}
