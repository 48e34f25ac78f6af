package com.realtime.teamhub.membership.repository;

import com.realtime.teamhub.membership.entity.OrganizationMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface OrganizationMemberRepository extends JpaRepository<OrganizationMember, Long> {

    boolean existsByOrgIdAndUserId(UUID orgId, UUID userId);
}
