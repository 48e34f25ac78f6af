package com.realtime.teamhub.inbox.repository;

import com.realtime.teamhub.inbox.entity.InboxItem;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface InboxItemRepository extends JpaRepository<InboxItem, UUID> {

    Optional<InboxItem> findByIdAndUserId(UUID id, UUID userId);

    Page<InboxItem> findByUserIdAndOrgIdAndArchived(UUID userId, UUID orgId, boolean archived, Pageable pageable);

    Page<InboxItem> findByUserIdAndOrgIdAndArchivedAndRead(UUID userId, UUID orgId, boolean archived,
                                                           boolean read, Pageable pageable);

    long countByUserIdAndOrgIdAndReadFalseAndArchivedFalse(UUID userId, UUID orgId);
}
