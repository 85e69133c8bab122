package com.marketplace.compliance.infrastructure.persistence.repository;

import com.marketplace.compliance.infrastructure.persistence.entity.StoreEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StoreRepository extends JpaRepository<StoreEntity, UUID> {

    /**
     * Find store with pessimistic write lock.
     *
     * Every KYC derivation for a store takes this lock before reading the store's
     * license statuses, so concurrent transitions on different licenses of the same
     * store derive one after the other and each sees the other's committed status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StoreEntity s where s.id = :id")
    Optional<StoreEntity> findByIdForUpdate(@Param("id") UUID id);
}
