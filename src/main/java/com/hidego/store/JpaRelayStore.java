package com.hidego.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hidego.config.HidegoProperties;
import com.hidego.crypto.EncryptionException;
import com.hidego.crypto.Encryptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * {@link RelayStore} on Spring Data JPA. Each call commits on its own; SQLite's WAL
 * mode and busy timeout serialize concurrent writers.
 */
@Service
public class JpaRelayStore implements RelayStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRelayStore.class);

    private final TenantRegistrationRepository registrations;
    private final BlockEntryRepository blocks;
    private final MessageHashRepository messageHashes;
    private final ReadHashRepository readHashes;
    private final Encryptor encryptor;
    private final Cache<String, Long> adminIds;

    public JpaRelayStore(TenantRegistrationRepository registrations,
                         BlockEntryRepository blocks,
                         MessageHashRepository messageHashes,
                         ReadHashRepository readHashes,
                         Encryptor encryptor,
                         HidegoProperties properties) {
        this.registrations = registrations;
        this.blocks = blocks;
        this.messageHashes = messageHashes;
        this.readHashes = readHashes;
        this.encryptor = encryptor;
        this.adminIds = Caffeine.newBuilder()
                .maximumSize(properties.getStore().getAdminCacheSize())
                .build();
    }

    @Override
    public boolean storeSplitHash(String prefix, String storedPortion, HashTable table, String periodTag) {
        try {
            boolean exists = switch (table) {
                case MESSAGES -> messageHashes.existsById(prefix);
                case READS -> readHashes.existsById(prefix);
            };
            if (exists) {
                log.warn("Split hash prefix collision in {}", table);
                return false;
            }
            switch (table) {
                case MESSAGES -> messageHashes.save(new MessageHash(prefix, storedPortion, periodTag));
                case READS -> readHashes.save(new ReadHash(prefix, storedPortion));
            }
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to store split hash in {}", table, e);
            return false;
        }
    }

    @Override
    public Optional<String> getFullHashByPrefix(String prefix, String suffix, HashTable table) {
        Optional<? extends SplitHashRecord> found = switch (table) {
            case MESSAGES -> messageHashes.findById(prefix);
            case READS -> readHashes.findById(prefix);
        };
        return found.map(r -> r.getPartialHash() + suffix);
    }

    @Override
    public boolean removePartialHash(String prefix, HashTable table) {
        int removed = switch (table) {
            case MESSAGES -> messageHashes.deletePrefix(prefix);
            case READS -> readHashes.deletePrefix(prefix);
        };
        return removed > 0;
    }

    @Override
    public boolean addTenantRegistration(String credentialToken, String botUsername, long adminId) {
        String encryptedToken = encryptor.encryptDeterministic(credentialToken);
        try {
            if (registrations.existsById(encryptedToken)) {
                return false;
            }
            registrations.save(new TenantRegistration(encryptedToken,
                    encryptor.encryptDeterministic(botUsername),
                    encryptor.encryptDeterministic(Long.toString(adminId))));
        } catch (DataAccessException e) {
            log.error("Failed to add tenant registration for @{}", botUsername, e);
            return false;
        }
        adminIds.invalidate(botUsername);
        log.info("Registered tenant @{}", botUsername);
        return true;
    }

    @Override
    public boolean removeTenantRegistration(String encryptedCredentialToken) {
        Optional<TenantRegistration> registration = registrations.findById(encryptedCredentialToken);
        if (registration.isEmpty()) {
            return false;
        }
        registrations.delete(registration.get());
        try {
            adminIds.invalidate(encryptor.decrypt(registration.get().getBotUsername()));
        } catch (EncryptionException e) {
            log.warn("Could not decrypt removed registration's bot username, clearing admin cache");
            adminIds.invalidateAll();
        }
        return true;
    }

    @Override
    public boolean isRegisteredTenant(String credentialToken) {
        return registrations.existsById(encryptor.encryptDeterministic(credentialToken));
    }

    @Override
    public boolean isAdmin(long userId, String botUsername) {
        String encryptedUser = encryptor.encryptDeterministic(Long.toString(userId));
        if (botUsername == null) {
            return registrations.existsByOwnerAdminId(encryptedUser);
        }
        return registrations.existsByOwnerAdminIdAndBotUsername(
                encryptedUser, encryptor.encryptDeterministic(botUsername));
    }

    @Override
    public Optional<Long> getAdminIdForTenant(String botUsername) {
        return Optional.ofNullable(adminIds.get(botUsername, this::loadAdminId));
    }

    private Long loadAdminId(String botUsername) {
        Optional<TenantRegistration> registration =
                registrations.findFirstByBotUsername(encryptor.encryptDeterministic(botUsername));
        if (registration.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(encryptor.decrypt(registration.get().getOwnerAdminId()));
        } catch (EncryptionException | NumberFormatException e) {
            log.error("Stored admin id for @{} is unreadable", botUsername, e);
            return null;
        }
    }

    @Override
    public boolean isUserBlocked(long userId, String botUsername) {
        return blocks.existsById(blockKey(userId, botUsername));
    }

    @Override
    public boolean blockUser(long userId, String botUsername) {
        BlockEntry.Key key = blockKey(userId, botUsername);
        try {
            if (blocks.existsById(key)) {
                return false;
            }
            blocks.save(new BlockEntry(key.getBlockedUserId(), key.getBotUsername()));
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to block user on @{}", botUsername, e);
            return false;
        }
    }

    @Override
    public boolean unblockUser(long userId, String botUsername) {
        BlockEntry.Key key = blockKey(userId, botUsername);
        return blocks.deleteEntry(key.getBlockedUserId(), key.getBotUsername()) > 0;
    }

    @Override
    public int purgeMessageHashesBefore(String periodTag) {
        return messageHashes.deleteIssuedBefore(periodTag);
    }

    private BlockEntry.Key blockKey(long userId, String botUsername) {
        return new BlockEntry.Key(
                encryptor.encryptDeterministic(Long.toString(userId)),
                encryptor.encryptDeterministic(botUsername));
    }
}
