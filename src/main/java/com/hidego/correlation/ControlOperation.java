package com.hidego.correlation;

import java.util.Optional;

/**
 * Operation codes of token-carrying buttons. Codes are a single character so that
 * {@code code|prefix|suffix} stays within the platform's 64-byte callback limit.
 */
public enum ControlOperation {

    BLOCK("b"),
    ANSWER("a"),
    READ("r");

    private final String code;

    ControlOperation(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ControlOperation> fromCode(String code) {
        for (ControlOperation op : values()) {
            if (op.code.equals(code)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
