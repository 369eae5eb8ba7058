package com.querydesk.portal.repository;

import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface QueryRepository extends JpaRepository<Query, Long>, JpaSpecificationExecutor<Query> {

    long countByStatus(QueryStatus status);

    Page<Query> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<Query> findByRequesterIdentityOrderByCreatedAtDesc(String requesterIdentity);

    List<Query> findByRequesterIdentityIsNullAndRequesterEmailIgnoreCaseOrderByCreatedAtDesc(String requesterEmail);

    @org.springframework.data.jpa.repository.Query(
            "SELECT q.createdAt FROM Query q WHERE q.createdAt >= :from AND q.createdAt < :to")
    List<LocalDateTime> findCreatedAtBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Modifying
    @org.springframework.data.jpa.repository.Query(
            "UPDATE Query q SET q.responseSeen = true WHERE q.requesterIdentity = :identity " +
            "AND q.adminResponse IS NOT NULL AND q.responseSeen = false")
    int markRepliesSeen(@Param("identity") String requesterIdentity);
}
