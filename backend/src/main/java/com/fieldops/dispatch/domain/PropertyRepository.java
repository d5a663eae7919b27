package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.PropertyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
public interface PropertyRepository extends JpaRepository<PropertyEntity,Long> { List<PropertyEntity> findByCustomerIdOrderByIdAsc(Long customerId); }
