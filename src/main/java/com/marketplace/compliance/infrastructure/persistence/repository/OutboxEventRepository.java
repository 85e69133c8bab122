package com.marketplace.compliance.infrastructure.persistence.repository;

import com.marketplace.compliance.domain.model.AggregateType;
import com.marketplace.compliance.infrastructure.persistence.entity.OutboxEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc(AggregateType aggregateType,
                                                                               UUID aggregateId);
}
