package com.hidego.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface MessageHashRepository extends JpaRepository<MessageHash, String> {

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from MessageHash m where m.prefixKey = :prefix")
    int deletePrefix(@Param("prefix") String prefix);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from MessageHash m where m.periodTag < :cutoff")
    int deleteIssuedBefore(@Param("cutoff") String cutoffPeriodTag);
}
