package com.clapgrow.channels.whatsapp.transport;

/**
 * Why a transport session ended. The supervisor's reconnect policy is keyed on these values.
 */
public enum CloseReason {
    /** The device was unlinked from the phone. */
    LOGGED_OUT,
    /** Another client took over the session. */
    REPLACED,
    /** Stored credentials are unusable. */
    BAD_SESSION,
    /** The remote side asked for a fresh connection. */
    RESTART_REQUIRED,
    CONNECTION_LOST,
    CONNECTION_CLOSED,
    TIMED_OUT,
    SERVER_ERROR,
    UNKNOWN
}
