// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

/** Kind of {@link Notice}. */
public enum NoticeType {
    /** A completed call, with its command, outcome and timing. */
    CALL,
    /** Free-form information from an adapter (failover, reconnect). */
    INFO
}
