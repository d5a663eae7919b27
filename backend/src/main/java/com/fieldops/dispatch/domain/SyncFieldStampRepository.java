package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.SyncEntityType;
import com.fieldops.dispatch.domain.Entities.SyncFieldStampEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;
public interface SyncFieldStampRepository extends JpaRepository<SyncFieldStampEntity,Long> {
  Optional<SyncFieldStampEntity> findByEntityTypeAndEntityIdAndField(SyncEntityType entityType, Long entityId, String field);
}
