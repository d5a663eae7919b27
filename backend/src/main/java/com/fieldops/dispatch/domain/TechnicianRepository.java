package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.TechnicianEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
public interface TechnicianRepository extends JpaRepository<TechnicianEntity,Long> {
  List<TechnicianEntity> findByActiveTrueOrderByIdAsc();
  List<TechnicianEntity> findByActiveTrueAndOnCallTrueOrderByIdAsc();
}
