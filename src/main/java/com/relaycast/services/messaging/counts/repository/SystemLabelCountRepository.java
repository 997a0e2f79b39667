package com.relaycast.services.messaging.counts.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.counts.model.SystemLabelCount;

public interface SystemLabelCountRepository extends JpaRepository<SystemLabelCount, Long> {

    /**
     * Rows of (label type, total) for an org
     */
    @Query("SELECT c.labelType, COALESCE(SUM(c.count), 0) FROM SystemLabelCount c WHERE c.orgId = :orgId GROUP BY c.labelType")
    List<Object[]> sumByLabelType(@Param("orgId") Long orgId);
}
