package com.hidego.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface BlockEntryRepository extends JpaRepository<BlockEntry, BlockEntry.Key> {

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from BlockEntry b where b.blockedUserId = :userId and b.botUsername = :botUsername")
    int deleteEntry(@Param("userId") String blockedUserId, @Param("botUsername") String botUsername);
}
