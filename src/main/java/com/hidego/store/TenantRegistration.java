package com.hidego.store;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

/**
 * One hosted bot. All three columns hold deterministic ciphertext so they can be
 * matched by equality; none is ever stored in the clear.
 */
@Entity
@Table(name = "tenant_registrations")
public class TenantRegistration implements Persistable<String> {

    @Id
    @Column(name = "credential_token", nullable = false, length = 512)
    private String credentialToken;

    @Column(name = "bot_username", nullable = false, length = 512)
    private String botUsername;

    @Column(name = "owner_admin_id", nullable = false, length = 512)
    private String ownerAdminId;

    @Transient
    private boolean persisted;

    public TenantRegistration() {}

    public TenantRegistration(String credentialToken, String botUsername, String ownerAdminId) {
        this.credentialToken = credentialToken;
        this.botUsername = botUsername;
        this.ownerAdminId = ownerAdminId;
    }

    @Override
    public String getId() { return credentialToken; }

    @Override
    public boolean isNew() { return !persisted; }

    @PostLoad
    @PostPersist
    void markPersisted() { this.persisted = true; }

    public String getCredentialToken() { return credentialToken; }
    public String getBotUsername() { return botUsername; }
    public String getOwnerAdminId() { return ownerAdminId; }
}
