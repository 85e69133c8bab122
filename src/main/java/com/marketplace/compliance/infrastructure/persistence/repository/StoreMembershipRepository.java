package com.marketplace.compliance.infrastructure.persistence.repository;

import com.marketplace.compliance.domain.model.MemberRole;
import com.marketplace.compliance.infrastructure.persistence.entity.StoreMembershipEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.UUID;

@Repository
public interface StoreMembershipRepository extends JpaRepository<StoreMembershipEntity, UUID> {

    boolean existsByStoreIdAndUserIdAndRoleIn(UUID storeId, UUID userId, Collection<MemberRole> roles);
}
