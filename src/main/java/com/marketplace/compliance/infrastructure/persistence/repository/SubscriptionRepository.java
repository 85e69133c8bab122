package com.marketplace.compliance.infrastructure.persistence.repository;

import com.marketplace.compliance.infrastructure.persistence.entity.SubscriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

    Optional<SubscriptionEntity> findByExternalSubscriptionId(String externalSubscriptionId);
}
