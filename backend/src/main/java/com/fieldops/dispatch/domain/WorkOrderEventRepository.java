package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.WorkOrderEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
public interface WorkOrderEventRepository extends JpaRepository<WorkOrderEventEntity,Long> { List<WorkOrderEventEntity> findByWorkOrderIdOrderByIdAsc(Long workOrderId); }
