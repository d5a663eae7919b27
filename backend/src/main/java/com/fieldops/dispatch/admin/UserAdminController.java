package com.fieldops.dispatch.admin;

import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.Entities.Role;
import com.fieldops.dispatch.domain.Entities.UserEntity;
import com.fieldops.dispatch.domain.TechnicianRepository;
import com.fieldops.dispatch.domain.UserRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/admin/users")
public class UserAdminController {
  private final UserRepository users;
  private final TechnicianRepository technicians;
  private final PasswordEncoder encoder;

  public UserAdminController(UserRepository users, TechnicianRepository technicians, PasswordEncoder encoder) {
    this.users = users;
    this.technicians = technicians;
    this.encoder = encoder;
  }

  public record UserUpsertReq(@NotBlank String username, String password, @NotNull Role role, Long technicianId, Boolean active) {}

  @GetMapping
  List<Map<String, Object>> list() {
    return users.findAll().stream().map(UserAdminController::view).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  Map<String, Object> create(@Valid @RequestBody UserUpsertReq req) {
    if (users.findByUsername(req.username()).isPresent()) {
      throw new DispatchException(HttpStatus.CONFLICT, "USERNAME_TAKEN", "Username already exists");
    }
    if (req.password() == null || req.password().isBlank()) {
      throw new ValidationException("password is required", "password");
    }
    UserEntity u = new UserEntity();
    apply(u, req);
    return view(users.save(u));
  }

  @PutMapping("/{id}")
  Map<String, Object> update(@PathVariable Long id, @Valid @RequestBody UserUpsertReq req) {
    UserEntity u = users.findById(id).orElseThrow(() -> new NotFoundException("User", id));
    users.findByUsername(req.username()).filter(other -> !other.id.equals(id)).ifPresent(other -> {
      throw new DispatchException(HttpStatus.CONFLICT, "USERNAME_TAKEN", "Username already exists");
    });
    apply(u, req);
    return view(users.save(u));
  }

  private void apply(UserEntity u, UserUpsertReq req) {
    if (req.role() == Role.TECHNICIAN) {
      if (req.technicianId() == null) {
        throw new ValidationException("Technician users must be linked to a technician", "technicianId");
      }
      technicians.findById(req.technicianId()).orElseThrow(() -> new NotFoundException("Technician", req.technicianId()));
    }
    u.username = req.username();
    if (req.password() != null && !req.password().isBlank()) u.passwordHash = encoder.encode(req.password());
    u.role = req.role();
    u.technicianId = req.role() == Role.TECHNICIAN ? req.technicianId() : null;
    u.active = req.active() == null || req.active();
  }

  private static Map<String, Object> view(UserEntity u) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", u.id);
    m.put("username", u.username);
    m.put("role", u.role.name());
    m.put("technicianId", u.technicianId);
    m.put("active", u.active);
    return m;
  }
}
