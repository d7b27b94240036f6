package io.quorumbridge.model;

public enum LifecycleState {
    ACTIVE,
    PAUSED,
    HALTED
}
