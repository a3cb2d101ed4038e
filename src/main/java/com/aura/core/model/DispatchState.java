package com.aura.core.model;

/**
 * States of the dispatch state machine.
 */
public enum DispatchState {
    RESOLVING,
    EXECUTING,
    PERSISTING,
    MISSED,
    GENERATING,
    AUDITING,
    INSTALLING,
    DONE,       // terminal: success
    FAILED,     // terminal: execution fault or infrastructure failure
    REJECTED;   // terminal: generated code failed the audit

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == REJECTED;
    }
}
