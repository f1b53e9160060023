package com.hidego.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TenantRegistrationRepository extends JpaRepository<TenantRegistration, String> {

    boolean existsByOwnerAdminId(String ownerAdminId);

    boolean existsByOwnerAdminIdAndBotUsername(String ownerAdminId, String botUsername);

    Optional<TenantRegistration> findFirstByBotUsername(String botUsername);
}
