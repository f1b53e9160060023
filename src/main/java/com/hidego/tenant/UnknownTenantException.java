package com.hidego.tenant;

/**
 * A webhook delivery for a credential that is neither live nor registered.
 */
public class UnknownTenantException extends RuntimeException {

    public UnknownTenantException(String shortToken) {
        super("No tenant registered for " + shortToken);
    }
}
