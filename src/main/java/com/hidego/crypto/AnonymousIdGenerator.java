package com.hidego.crypto;

import java.util.Base64;

/**
 * Derives the stable pseudonym shown to an admin for "anonymous with history" messages.
 * Keyed by the master passphrase, so the id cannot be recomputed from a user id alone.
 */
public class AnonymousIdGenerator {

    private static final int ID_LENGTH = 10;
    private static final String LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private final byte[] key;

    public AnonymousIdGenerator(MasterPassphrase masterPassphrase) {
        this.key = KeyDerivation.hmacSha256(
                KeyDerivation.passphraseBytes(masterPassphrase.chars()), "hidego/anonymous-id");
    }

    public String conversationId(long userId, String firstName) {
        byte[] digest = KeyDerivation.hmacSha256(key, userId + (firstName != null ? firstName : ""));
        StringBuilder alphanumeric = new StringBuilder(alphanumeric(digest));
        byte[] next = digest;
        while (alphanumeric.length() < ID_LENGTH) {
            next = KeyDerivation.hmacSha256(key, next);
            alphanumeric.append(alphanumeric(next));
        }

        char[] id = alphanumeric.substring(0, ID_LENGTH).toCharArray();
        if (!Character.isLetter(id[0])) {
            id[0] = LETTERS.charAt(Byte.toUnsignedInt(digest[0]) % LETTERS.length());
        }
        return "#" + new String(id);
    }

    private static String alphanumeric(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes).replaceAll("[^A-Za-z0-9]", "");
    }
}
