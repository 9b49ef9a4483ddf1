package com.tcpchat.session;

/**
 * Lifecycle of one connection.
 *
 * AWAITING_JOIN → ACTIVE → CLOSING → CLOSED, where CLOSING can be entered
 * from any state and CLOSED is terminal.
 */
public enum SessionState {
    AWAITING_JOIN,
    ACTIVE,
    CLOSING,
    CLOSED
}
