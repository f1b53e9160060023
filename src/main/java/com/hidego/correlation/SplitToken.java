package com.hidego.correlation;

/**
 * An encrypted record divided between the server ({@code storedPortion}, keyed by
 * {@code prefix}) and the button payload ({@code prefix} and {@code suffix}).
 */
public record SplitToken(String prefix, String suffix, String storedPortion) {

    public String toPayload(ControlOperation operation) {
        return operation.code() + CallbackData.SEPARATOR + prefix + CallbackData.SEPARATOR + suffix;
    }

    @Override
    public String toString() {
        return "SplitToken[prefix=" + prefix.substring(0, Math.min(6, prefix.length())) + "...]";
    }
}
