package com.hidego.i18n;

/**
 * Keys into the {@code messages*.properties} bundles.
 */
public enum ResponseKey {

    // dispatcher bot
    WELCOME("dispatcher.welcome"),
    ABOUT("dispatcher.about"),
    PROVIDE_TOKEN("dispatcher.register.provide-token"),
    INVALID_TOKEN("dispatcher.register.invalid-token"),
    ALREADY_REGISTERED("dispatcher.register.already-registered"),
    WAIT_REGISTERING_BOT("dispatcher.register.wait"),
    ADMIN_REGISTERED("dispatcher.register.admin-registered"),
    ALREADY_ADMIN("dispatcher.register.already-admin"),
    REGISTRATION_FAILED("dispatcher.register.failed"),
    BOT_REGISTERED_SUCCESS("dispatcher.register.success"),
    BOT_REGISTERED_SUCCESS_BUTTON("dispatcher.register.success-button"),
    REVOKE_INSTRUCTIONS("dispatcher.revoke.instructions"),
    INVALID_PINNED_MESSAGE("dispatcher.revoke.invalid-pinned-message"),
    REVOKE_SUCCESS("dispatcher.revoke.success"),
    REVOKE_ERROR("dispatcher.revoke.error"),
    DISPATCHER_SHORT_DESCRIPTION("dispatcher.profile.short-description"),
    DISPATCHER_DESCRIPTION("dispatcher.profile.description"),
    COMMAND_REGISTER("command.register"),
    COMMAND_REVOKE("command.revoke"),
    COMMAND_ABOUT("command.about"),

    // tenant bots
    START("tenant.start"),
    PRIVACY("tenant.privacy"),
    TENANT_SHORT_DESCRIPTION("tenant.profile.short-description"),
    COMMAND_START("command.start"),
    COMMAND_PRIVACY("command.privacy"),
    CHOICE_PROMPT("tenant.choice.prompt"),
    CHOICE_NO_HISTORY("tenant.choice.no-history"),
    CHOICE_WITH_HISTORY("tenant.choice.with-history"),
    CHOICE_FORWARD("tenant.choice.forward"),
    ENCRYPTING_MESSAGE("tenant.dispatch.encrypting"),
    MESSAGE_SENT_NO_HISTORY("tenant.dispatch.sent-no-history"),
    MESSAGE_SENT_WITH_HISTORY("tenant.dispatch.sent-with-history"),
    MESSAGE_FORWARDED("tenant.dispatch.forwarded"),
    ERROR_SENDING_MESSAGE("tenant.dispatch.error"),
    ORIGINAL_MESSAGE_MISSING("tenant.dispatch.original-missing"),
    NO_ADMIN("tenant.dispatch.no-admin"),
    UNSUPPORTED_CONTENT("tenant.dispatch.unsupported-content"),
    USER_BLOCKED("tenant.user-blocked"),
    INVALID_MESSAGE_DATA("admin.invalid-message-data"),
    UNKNOWN_OPERATION("admin.unknown-operation"),
    ONGOING_REPLY("admin.reply.ongoing"),
    BUTTON_CANCEL_REPLY("admin.reply.cancel-button"),
    REPLY_CANCELED("admin.reply.canceled"),
    REPLY_WAIT("admin.reply.wait"),
    REPLY_AWAITING("admin.reply.awaiting"),
    REPLY_ERROR("admin.reply.error"),
    REPLY_TIMEOUT("admin.reply.timeout"),
    MUST_USE_ANSWER_BUTTON("admin.reply.use-answer-button"),
    REPLY_SENT("admin.reply.sent"),
    REPLY_FAILED("admin.reply.failed"),
    REPLY_FAILED_RECIPIENT_BLOCKED_BOT("admin.reply.failed-recipient-blocked-bot"),
    REPLY_FAILED_RETRY("admin.reply.failed-retry"),
    USER_BLOCKED_DONE("admin.block.blocked"),
    USER_UNBLOCKED_DONE("admin.block.unblocked"),
    BLOCK_ERROR("admin.block.error"),
    UNBLOCK_ERROR("admin.block.unblock-error"),
    MESSAGE_MARKED_READ("read.marked");

    private final String code;

    ResponseKey(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
