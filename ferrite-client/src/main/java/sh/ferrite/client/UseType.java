// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

/**
 * Connection mode of the {@link Adapter} behind a client.
 *
 * <p>Some commands only make sense in certain modes (a {@code CLUSTER} subcommand on a
 * pooled single-node client, a blocking pop on a temporary connection).
 * {@link FerriteClient#checkUseTypeOrThrow(UseType...)} takes the modes a method supports
 * and rejects calls in any other mode before they reach the call pipeline.
 */
public enum UseType {
    /** Pooled connections to one node, optionally with read replicas. */
    POOLING,
    /** Slot-routed connections to a cluster. */
    CLUSTER,
    /** Master discovered through sentinels. */
    SENTINEL,
    /** A single dedicated connection owned by another client (transactions, pipelines). */
    SINGLE_INSIDE,
    /** A short-lived single connection. */
    SINGLE_TEMP
}
