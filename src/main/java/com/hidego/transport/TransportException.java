package com.hidego.transport;

/**
 * A failed platform call. {@link #kind()} decides the fallback a caller applies.
 */
public class TransportException extends RuntimeException {

    private final TransportErrorKind kind;
    private final String method;

    public TransportException(TransportErrorKind kind, String method, String description) {
        super(method + " failed (" + kind + "): " + description);
        this.kind = kind;
        this.method = method;
    }

    public TransportException(TransportErrorKind kind, String method, String description, Throwable cause) {
        super(method + " failed (" + kind + "): " + description, cause);
        this.kind = kind;
        this.method = method;
    }

    public TransportErrorKind kind() { return kind; }
    public String method() { return method; }

    public boolean is(TransportErrorKind expected) {
        return kind == expected;
    }

    public static boolean isKind(Throwable error, TransportErrorKind expected) {
        return error instanceof TransportException te && te.kind == expected;
    }
}
