package com.fieldops.dispatch.domain;

import com.fieldops.dispatch.domain.Entities.SyncItemStatus;
import com.fieldops.dispatch.domain.Entities.SyncQueueItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface SyncQueueItemRepository extends JpaRepository<SyncQueueItemEntity,Long> {
  Optional<SyncQueueItemEntity> findByIdempotencyKey(String idempotencyKey);
  List<SyncQueueItemEntity> findByStatusOrderByIdAsc(SyncItemStatus status);
  List<SyncQueueItemEntity> findByStatusAndNextAttemptAtLessThanEqualOrderByIdAsc(SyncItemStatus status, OffsetDateTime cutoff);
  long countByStatus(SyncItemStatus status);
}
