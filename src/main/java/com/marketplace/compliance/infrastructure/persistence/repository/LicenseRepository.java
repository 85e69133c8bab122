package com.marketplace.compliance.infrastructure.persistence.repository;

import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.infrastructure.persistence.entity.LicenseEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LicenseRepository extends JpaRepository<LicenseEntity, UUID> {

    /**
     * Reads the license under a row lock for the rest of the enclosing transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from LicenseEntity l where l.id = :id")
    Optional<LicenseEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("select l.status from LicenseEntity l where l.storeId = :storeId")
    List<LicenseStatus> findStatusesByStoreId(@Param("storeId") UUID storeId);

    long countByStoreIdAndStatus(UUID storeId, LicenseStatus status);

    List<LicenseEntity> findByExpirationDateAndStatusInOrderByIdAsc(LocalDate expirationDate,
                                                                   Collection<LicenseStatus> statuses);

    List<LicenseEntity> findByExpirationDateLessThanEqualAndStatusInOrderByExpirationDateAscIdAsc(
            LocalDate expirationDate, Collection<LicenseStatus> statuses);

    List<LicenseEntity> findByStatusAndExpirationDateBeforeOrderByExpirationDateAscIdAsc(
            LicenseStatus status, LocalDate cutoff);

    @Query("select l from LicenseEntity l where l.storeId = :storeId order by l.createdAt desc, l.id desc")
    List<LicenseEntity> findFirstPage(@Param("storeId") UUID storeId, Pageable pageable);

    @Query("select l from LicenseEntity l where l.storeId = :storeId "
            + "and (l.createdAt < :createdAt or (l.createdAt = :createdAt and l.id < :id)) "
            + "order by l.createdAt desc, l.id desc")
    List<LicenseEntity> findPageAfter(@Param("storeId") UUID storeId,
                                      @Param("createdAt") Instant createdAt,
                                      @Param("id") UUID id,
                                      Pageable pageable);
}
