package com.hidego.tenant;

public enum SubmitResult {
    ACCEPTED,
    /** The inbound queue is full. */
    OVERLOADED,
    /** The runtime is not running. */
    STOPPED
}
