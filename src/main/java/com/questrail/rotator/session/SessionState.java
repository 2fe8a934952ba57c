package com.questrail.rotator.session;

/**
 * Lifecycle of a translator session.
 *
 * <pre>
 *   CONNECTING ──device up──▶ ACTIVE ──client gone / error / cancel──▶ CLOSING ──▶ CLOSED
 *        │                                                                          ▲
 *        └──────────────────────────device connect failed───────────────────────────┘
 * </pre>
 */
public enum SessionState {
    /** Opening the device connection; no client command has been read. */
    CONNECTING,
    /** Serving client commands, one at a time. */
    ACTIVE,
    /** Releasing both connections. */
    CLOSING,
    /** Terminal. No further I/O. */
    CLOSED
}
