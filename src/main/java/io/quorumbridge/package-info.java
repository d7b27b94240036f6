/**
 * quorum-bridge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.quorumbridge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.quorumbridge.cli.QuorumBridgeCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.quorumbridge.runtime.BridgeRuntime} loads deployments and commits each ledger call.</li>
 *   <li>{@code io.quorumbridge.ledger.BridgeLedger} holds the bridging rules shared by both ledger variants.</li>
 *   <li>{@code io.quorumbridge.auth.OperationAuthorizer} is the 3-of-4 approval state machine.</li>
 * </ul>
 */
package io.quorumbridge;
