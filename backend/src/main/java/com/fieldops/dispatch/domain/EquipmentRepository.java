package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.EquipmentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
public interface EquipmentRepository extends JpaRepository<EquipmentEntity,Long> { List<EquipmentEntity> findByPropertyIdOrderByIdAsc(Long propertyId); }
