package io.chunkvault.session;

/**
 * Upload session lifecycle: CREATED, RECEIVING, then FINALIZING into COMMITTED,
 * or EXPIRED after inactivity or cancellation.
 */
public enum SessionState {
    CREATED,
    RECEIVING,
    FINALIZING,
    COMMITTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMMITTED || this == EXPIRED;
    }
}
