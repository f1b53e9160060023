package com.hidego.session;

/**
 * One pending-reply slot: an admin answering through one tenant bot. An admin of
 * several tenants holds an independent slot per tenant.
 */
public record ReplySlot(long adminId, String botUsername) {}
