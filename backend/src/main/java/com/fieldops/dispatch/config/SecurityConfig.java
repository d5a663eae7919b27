package com.fieldops.dispatch.config;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.*;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

import static org.springframework.security.config.Customizer.withDefaults;

@Configuration
public class SecurityConfig {
  private static final String[] OFFICE = {"DISPATCHER", "ADMIN"};
  private static final String[] FIELD = {"TECHNICIAN", "DISPATCHER", "ADMIN"};

  @Bean PasswordEncoder passwordEncoder(){ return new BCryptPasswordEncoder(); }

  @Bean
  CorsConfigurationSource corsConfigurationSource(@Value("${app.cors.allowed-origins:http://localhost:5173}") List<String> origins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowedOrigins(origins);
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setExposedHeaders(List.of(HttpHeaders.AUTHORIZATION));
    config.setAllowCredentials(true);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }

  @Bean SecurityFilterChain filterChain(HttpSecurity http, JwtFilter jwtFilter) throws Exception {
    return http.csrf(c->c.disable())
      .cors(withDefaults())
      .sessionManagement(s->s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
      .authorizeHttpRequests(a->a
        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
        .requestMatchers("/api/auth/**", "/actuator/health").permitAll()
        .requestMatchers("/api/admin/**").hasRole("ADMIN")
        .requestMatchers(HttpMethod.POST, "/api/sync/queue").hasAnyRole(FIELD)
        .requestMatchers(HttpMethod.POST, "/api/technicians/*/location").hasAnyRole(FIELD)
        .requestMatchers(HttpMethod.POST, "/api/work-orders/*/status").hasAnyRole(FIELD)
        .requestMatchers(HttpMethod.GET, "/api/technicians/*/route", "/api/work-orders/*").hasAnyRole(FIELD)
        .requestMatchers("/api/**").hasAnyRole(OFFICE)
        .anyRequest().authenticated())
      .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
      .build();
  }

  @Component
  public static class JwtService {
    private final SecretKey key;
    private final Duration ttl;
    public JwtService(@Value("${app.jwt-secret}") String secret, @Value("${app.jwt-ttl:PT12H}") Duration ttl){
      this.key=Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
      this.ttl=ttl;
    }
    public String generate(String username,String role,Long technicianId){
      var builder=Jwts.builder().subject(username).claim("role", role).issuedAt(new Date()).expiration(new Date(System.currentTimeMillis()+ttl.toMillis()));
      if(technicianId!=null) builder.claim("technicianId", technicianId);
      return builder.signWith(key).compact();
    }
    public Jws<Claims> parse(String token){ return Jwts.parser().verifyWith(key).build().parseSignedClaims(token); }
  }

  @Component
  public static class JwtFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtFilter.class);
    private final JwtService jwt;
    public JwtFilter(JwtService jwt){this.jwt=jwt;}
    @Override protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain) throws ServletException, IOException {
      String h=req.getHeader(HttpHeaders.AUTHORIZATION);
      if(h!=null && h.startsWith("Bearer ")){
        try {
          Claims c=jwt.parse(h.substring(7)).getPayload();
          var auth=new UsernamePasswordAuthenticationToken(c.getSubject(),null, List.of(new SimpleGrantedAuthority("ROLE_"+c.get("role",String.class))));
          SecurityContextHolder.getContext().setAuthentication(auth);
        } catch (JwtException | IllegalArgumentException ex) {
          log.debug("Rejected bearer token path={} reason={}", req.getRequestURI(), ex.getMessage());
          SecurityContextHolder.clearContext();
        }
      }
      chain.doFilter(req,res);
    }
  }
}
