package com.hidego.tenant;

/**
 * A tenant runtime could not be provisioned: bad credential, platform unreachable,
 * webhook binding refused or creation timed out.
 */
public class RuntimeCreationException extends RuntimeException {

    public RuntimeCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
