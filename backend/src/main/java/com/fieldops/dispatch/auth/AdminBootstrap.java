package com.fieldops.dispatch.auth;

import com.fieldops.dispatch.domain.Entities.Role;
import com.fieldops.dispatch.domain.Entities.UserEntity;
import com.fieldops.dispatch.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/** Creates the first administrator on an empty user table. */
@Component
public class AdminBootstrap {
  private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);
  private final UserRepository users;
  private final PasswordEncoder encoder;
  private final String username;
  private final String password;

  public AdminBootstrap(UserRepository users, PasswordEncoder encoder,
                        @Value("${app.bootstrap.admin-username:admin}") String username,
                        @Value("${app.bootstrap.admin-password:}") String password) {
    this.users = users;
    this.encoder = encoder;
    this.username = username;
    this.password = password;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void createAdminIfEmpty() {
    if (users.count() > 0) {
      return;
    }
    if (password == null || password.isBlank()) {
      log.warn("No users exist and app.bootstrap.admin-password is not set; nobody can log in");
      return;
    }
    UserEntity admin = new UserEntity();
    admin.username = username;
    admin.passwordHash = encoder.encode(password);
    admin.role = Role.ADMIN;
    users.save(admin);
    log.info("Bootstrap administrator '{}' created", username);
  }
}
