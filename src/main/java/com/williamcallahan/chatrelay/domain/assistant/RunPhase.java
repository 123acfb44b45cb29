package com.williamcallahan.chatrelay.domain.assistant;

/**
 * Provider-neutral view of an assistant run's status.
 */
public enum RunPhase {
    /** Queued, in progress or cancelling; keep polling. */
    PENDING,
    COMPLETED,
    /** The run wants tool outputs, which this relay never provides. */
    REQUIRES_ACTION,
    /** Failed, cancelled, expired or incomplete. */
    FAILED
}
