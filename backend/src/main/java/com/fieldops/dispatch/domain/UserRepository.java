package com.fieldops.dispatch.domain;
import com.fieldops.dispatch.domain.Entities.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;
public interface UserRepository extends JpaRepository<UserEntity,Long> {
  Optional<UserEntity> findByUsernameAndActiveTrue(String username);
  Optional<UserEntity> findByUsername(String username);
}
