package com.hidego.session;

import reactor.core.Disposable;

/**
 * An admin's pending answer to one anonymous message.
 * <p>
 * {@code chatId} and {@code controlMessageId} locate the admin-side copy the answer
 * refers to; {@code targetUserId} and {@code originalMessageId} locate the sender's
 * message the reply is threaded onto.
 */
public class AdminReplySession {

    private final ReplySlot slot;
    private final long targetUserId;
    private final long originalMessageId;
    private final long chatId;
    private final long controlMessageId;
    private final String languageCode;
    private volatile Long promptMessageId;
    private volatile Disposable timeout;

    public AdminReplySession(ReplySlot slot, long targetUserId, long originalMessageId,
                             long chatId, long controlMessageId, String languageCode) {
        this.slot = slot;
        this.targetUserId = targetUserId;
        this.originalMessageId = originalMessageId;
        this.chatId = chatId;
        this.controlMessageId = controlMessageId;
        this.languageCode = languageCode;
    }

    public ReplySlot getSlot() { return slot; }
    public long getTargetUserId() { return targetUserId; }
    public long getOriginalMessageId() { return originalMessageId; }
    public long getChatId() { return chatId; }
    public long getControlMessageId() { return controlMessageId; }
    public String getLanguageCode() { return languageCode; }

    /** The "awaiting reply" prompt shown to the admin, once it has been sent. */
    public Long getPromptMessageId() { return promptMessageId; }
    public void setPromptMessageId(Long promptMessageId) { this.promptMessageId = promptMessageId; }

    void setTimeout(Disposable timeout) {
        this.timeout = timeout;
    }

    void cancelTimeout() {
        Disposable pending = timeout;
        if (pending != null) {
            pending.dispose();
        }
    }

    @Override
    public String toString() {
        return "AdminReplySession[bot=" + slot.botUsername() + ", prompt=" + promptMessageId + "]";
    }
}
