package com.hidego.store;

import java.util.Optional;

/**
 * Durable state of the relay: tenant registrations, block lists and the server half
 * of correlation tokens. Identifiers are passed in the clear and encrypted
 * deterministically before they reach storage.
 */
public interface RelayStore {

    /** Inserts a split hash. Returns false on a prefix collision; never overwrites. */
    boolean storeSplitHash(String prefix, String storedPortion, HashTable table, String periodTag);

    /** Stored portion for {@code prefix} joined with {@code suffix}, or empty on a miss. */
    Optional<String> getFullHashByPrefix(String prefix, String suffix, HashTable table);

    boolean removePartialHash(String prefix, HashTable table);

    /** Returns false when the credential is already registered. */
    boolean addTenantRegistration(String credentialToken, String botUsername, long adminId);

    boolean removeTenantRegistration(String encryptedCredentialToken);

    boolean isRegisteredTenant(String credentialToken);

    /** With a null {@code botUsername}, whether the user administers any tenant. */
    boolean isAdmin(long userId, String botUsername);

    Optional<Long> getAdminIdForTenant(String botUsername);

    boolean isUserBlocked(long userId, String botUsername);

    boolean blockUser(long userId, String botUsername);

    boolean unblockUser(long userId, String botUsername);

    /** Deletes admin-control records issued before {@code periodTag} ({@code yyyy-MM}). */
    int purgeMessageHashesBefore(String periodTag);
}
