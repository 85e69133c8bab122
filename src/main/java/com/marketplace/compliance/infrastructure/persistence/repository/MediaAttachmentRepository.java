package com.marketplace.compliance.infrastructure.persistence.repository;

import com.marketplace.compliance.infrastructure.persistence.entity.MediaAttachmentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface MediaAttachmentRepository extends JpaRepository<MediaAttachmentEntity, UUID> {

    List<MediaAttachmentEntity> findByEntityTypeAndEntityId(String entityType, UUID entityId);

    @Modifying
    @Query("delete from MediaAttachmentEntity a where a.entityType = :entityType "
            + "and a.entityId = :entityId and a.mediaId in :mediaIds")
    int deleteLinks(@Param("entityType") String entityType,
                    @Param("entityId") UUID entityId,
                    @Param("mediaIds") Collection<UUID> mediaIds);
}
