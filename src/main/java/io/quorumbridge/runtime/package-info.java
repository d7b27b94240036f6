/**
 * Deployment orchestration.
 *
 * <p>{@link io.quorumbridge.runtime.BridgeRuntime} loads a stored deployment, applies one ledger call and
 * commits the resulting state and events in a single transaction.
 */
package io.quorumbridge.runtime;
