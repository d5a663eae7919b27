package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.AssignmentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;
public interface AssignmentRepository extends JpaRepository<AssignmentEntity,Long> {
  Optional<AssignmentEntity> findFirstByWorkOrderIdAndActiveTrue(Long workOrderId);
  List<AssignmentEntity> findByWorkOrderIdAndActiveTrue(Long workOrderId);
  List<AssignmentEntity> findByWorkOrderIdOrderByIdAsc(Long workOrderId);
}
