package com.fieldops.dispatch.maintenance;

import com.fieldops.dispatch.domain.Entities.MaintenanceAgreementEntity;
import com.fieldops.dispatch.domain.ServiceCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@RestController @RequestMapping("/api/maintenance") @Validated
public class MaintenanceController {
  private final MaintenancePlanner planner;
  private final Clock clock;

  public MaintenanceController(MaintenancePlanner planner, Clock clock){this.planner=planner; this.clock=clock;}

  public record AgreementReq(@NotNull Long customerId, @NotNull Long propertyId, Long equipmentId, @NotNull ServiceCategory category,
                             @Min(1) @Max(60) Integer intervalMonths, @Min(1) @Max(720) Integer estimatedMinutes,
                             @NotNull LocalDate nextDueDate, Long preferredTechnicianId) {}

  @PostMapping("/agreements")
  @ResponseStatus(HttpStatus.CREATED)
  MaintenanceAgreementEntity create(@Valid @RequestBody AgreementReq req){
    MaintenanceAgreementEntity a = new MaintenanceAgreementEntity();
    a.customerId = req.customerId();
    a.propertyId = req.propertyId();
    a.equipmentId = req.equipmentId();
    a.category = req.category();
    if (req.intervalMonths() != null) a.intervalMonths = req.intervalMonths();
    if (req.estimatedMinutes() != null) a.estimatedMinutes = req.estimatedMinutes();
    a.nextDueDate = req.nextDueDate();
    a.preferredTechnicianId = req.preferredTechnicianId();
    return planner.createAgreement(a);
  }

  @PostMapping("/generate")
  Map<String,Object> generate(@RequestParam(required=false) @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date){
    LocalDate today = date == null ? LocalDate.now(clock) : date;
    var generated = planner.generate(today);
    return Map.of("ok", true, "date", today.toString(), "generated", generated);
  }
}
