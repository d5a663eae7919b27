package com.fieldops.dispatch.technician;

import com.fieldops.dispatch.domain.Entities.TechnicianEntity;
import com.fieldops.dispatch.domain.ServiceCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

@RestController @RequestMapping("/api/technicians") @Validated
public class TechnicianController {
  private final TechnicianService technicians;

  public TechnicianController(TechnicianService technicians){this.technicians=technicians;}

  public record CreateTechnicianReq(@NotBlank String name, @NotEmpty Set<ServiceCategory> skills, Set<String> certifications,
                                    Set<String> serviceAreas, Double homeLatitude, Double homeLongitude,
                                    LocalTime workdayStart, LocalTime workdayEnd, @Min(1) @Max(30) Integer maxJobsPerDay, boolean onCall) {}
  public record StatusReq(boolean active, boolean onCall) {}
  public record LocationReq(@NotNull Double latitude, @NotNull Double longitude, OffsetDateTime fixAt) {}

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  TechnicianEntity create(@Valid @RequestBody CreateTechnicianReq req){
    return technicians.create(new TechnicianService.NewTechnician(req.name(), req.skills(), req.certifications(), req.serviceAreas(),
        req.homeLatitude(), req.homeLongitude(), req.workdayStart(), req.workdayEnd(), req.maxJobsPerDay(), req.onCall()));
  }

  @GetMapping
  List<TechnicianEntity> list(){
    return technicians.list();
  }

  @GetMapping("/{id}")
  TechnicianEntity get(@PathVariable Long id){
    return technicians.get(id);
  }

  @PutMapping("/{id}/status")
  TechnicianEntity status(@PathVariable Long id, @RequestBody StatusReq req){
    return technicians.setActive(id, req.active(), req.onCall());
  }

  @PostMapping("/{id}/location")
  TechnicianService.LocationUpdate location(@PathVariable Long id, @Valid @RequestBody LocationReq req){
    return technicians.recordLocation(id, req.latitude(), req.longitude(), req.fixAt());
  }
}
