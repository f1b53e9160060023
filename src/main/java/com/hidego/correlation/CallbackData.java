package com.hidego.correlation;

/**
 * Literal values carried in inline-button callback data.
 */
public final class CallbackData {

    public static final String SEPARATOR = "|";
    public static final String ANONYMOUS_PREFIX = "SendAnon" + SEPARATOR;
    public static final String CANCEL_REPLY = "CancelReplyAnswer";

    private CallbackData() {}
}
