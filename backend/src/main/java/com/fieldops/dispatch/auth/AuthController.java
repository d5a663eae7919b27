package com.fieldops.dispatch.auth;

import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.config.SecurityConfig.JwtService;
import com.fieldops.dispatch.domain.UserRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController @RequestMapping("/api/auth") @Validated
public class AuthController {
  private static final Logger log = LoggerFactory.getLogger(AuthController.class);
  private final UserRepository users; private final PasswordEncoder encoder; private final JwtService jwt;
  public AuthController(UserRepository users, PasswordEncoder encoder, JwtService jwt){this.users=users;this.encoder=encoder;this.jwt=jwt;}
  public record LoginReq(@NotBlank String username,@NotBlank String password){}
  @PostMapping("/login")
  Map<String,Object> login(@Valid @RequestBody LoginReq req){
    var user=users.findByUsernameAndActiveTrue(req.username()).orElseThrow(AuthController::invalid);
    if(!encoder.matches(req.password(), user.passwordHash)) {
      log.info("Failed login username={}", req.username());
      throw invalid();
    }
    Map<String,Object> body=new LinkedHashMap<>();
    body.put("accessToken", jwt.generate(user.username, user.role.name(), user.technicianId));
    body.put("role", user.role.name());
    body.put("username", user.username);
    if(user.technicianId!=null) body.put("technicianId", user.technicianId);
    return body;
  }

  private static DispatchException invalid(){
    return new DispatchException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials");
  }
}
