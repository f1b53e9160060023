package com.hidego.transport;

public enum TransportErrorKind {
    /** The recipient blocked the bot or the bot lacks rights in the chat. */
    FORBIDDEN,
    /** Chat or message not found, content not copyable, malformed request. */
    BAD_REQUEST,
    /** The credential token was rejected. */
    UNAUTHORIZED,
    RATE_LIMITED,
    SERVER_ERROR,
    TIMEOUT,
    NETWORK;

    public boolean isTransient() {
        return this == TIMEOUT || this == NETWORK || this == SERVER_ERROR || this == RATE_LIMITED;
    }

    static TransportErrorKind fromErrorCode(int errorCode) {
        return switch (errorCode) {
            case 400 -> BAD_REQUEST;
            case 401, 404 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 429 -> RATE_LIMITED;
            default -> errorCode >= 500 ? SERVER_ERROR : BAD_REQUEST;
        };
    }
}
