package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.MaintenanceAgreementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.time.LocalDate;
import java.util.List;
public interface MaintenanceAgreementRepository extends JpaRepository<MaintenanceAgreementEntity,Long> {
  List<MaintenanceAgreementEntity> findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(LocalDate cutoff);
}
