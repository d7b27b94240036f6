package io.quorumbridge.ledger;

import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LifecycleState;
import io.quorumbridge.model.Rejection;

/**
 * ACTIVE and PAUSED toggle through approved operations; HALTED is terminal.
 */
final class Lifecycle {
    private LifecycleState state = LifecycleState.ACTIVE;

    LifecycleState state() {
        return state;
    }

    void restore(LifecycleState state) {
        this.state = state;
    }

    void pause() {
        requireNotHalted();
        LedgerException.require(state != LifecycleState.PAUSED, Rejection.ALREADY_PAUSED);
        state = LifecycleState.PAUSED;
    }

    void unpause() {
        requireNotHalted();
        LedgerException.require(state == LifecycleState.PAUSED, Rejection.NOT_PAUSED);
        state = LifecycleState.ACTIVE;
    }

    void halt() {
        state = LifecycleState.HALTED;
    }

    boolean isPaused() {
        return state == LifecycleState.PAUSED;
    }

    boolean isHalted() {
        return state == LifecycleState.HALTED;
    }

    void requireNotHalted() {
        LedgerException.require(state != LifecycleState.HALTED, Rejection.HALTED);
    }

    void requireActive() {
        requireNotHalted();
        LedgerException.require(state != LifecycleState.PAUSED, Rejection.PAUSED);
    }
}
