package com.fieldops.dispatch.domain;

import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkOrderRepository extends JpaRepository<WorkOrderEntity,Long> {
  Optional<WorkOrderEntity> findByIdempotencyKey(String idempotencyKey);

  List<WorkOrderEntity> findByServiceDateAndStatusIn(LocalDate serviceDate, Collection<WorkOrderStatus> statuses);

  List<WorkOrderEntity> findByServiceDateBetweenAndStatusIn(LocalDate from, LocalDate to, Collection<WorkOrderStatus> statuses);

  List<WorkOrderEntity> findByTechnicianIdAndServiceDateAndStatusIn(Long technicianId, LocalDate serviceDate, Collection<WorkOrderStatus> statuses);

  @Query("""
     select w from WorkOrderEntity w
     where (:date is null or w.serviceDate = :date)
       and (:status is null or w.status = :status)
       and (:technicianId is null or w.technicianId = :technicianId)
     order by w.serviceDate asc, w.id asc
  """)
  List<WorkOrderEntity> findFiltered(
      @Param("date") LocalDate date,
      @Param("status") WorkOrderStatus status,
      @Param("technicianId") Long technicianId
  );

  @Query("""
     select count(w) from WorkOrderEntity w
     where w.technicianId = :technicianId
       and w.status = com.fieldops.dispatch.domain.WorkOrderStatus.COMPLETED
       and (w.customerId = :customerId or w.propertyId = :propertyId)
  """)
  long countCompletedFor(
      @Param("technicianId") Long technicianId,
      @Param("customerId") Long customerId,
      @Param("propertyId") Long propertyId
  );
}
