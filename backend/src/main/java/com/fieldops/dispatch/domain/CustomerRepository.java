package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.CustomerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;
public interface CustomerRepository extends JpaRepository<CustomerEntity,Long> { Optional<CustomerEntity> findByIdAndDeletedFalse(Long id); }
