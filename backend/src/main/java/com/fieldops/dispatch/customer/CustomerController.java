package com.fieldops.dispatch.customer;

import com.fieldops.dispatch.domain.Entities.CustomerEntity;
import com.fieldops.dispatch.domain.Entities.EquipmentEntity;
import com.fieldops.dispatch.domain.Entities.PropertyEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

@RestController @RequestMapping("/api") @Validated
public class CustomerController {
  private final CustomerService customers;

  public CustomerController(CustomerService customers){this.customers=customers;}

  public record CustomerReq(@NotBlank String name, String phone, @Email String email) {}
  public record PropertyReq(@NotBlank String street, String city, String state, @NotBlank String zip,
                            Double latitude, Double longitude, String accessInstructions, String hazards) {}
  public record EquipmentReq(@NotBlank String type, String make, String model, LocalDate installDate, Integer serviceIntervalMonths) {}

  @PostMapping("/customers")
  @ResponseStatus(HttpStatus.CREATED)
  CustomerEntity create(@Valid @RequestBody CustomerReq req){
    return customers.create(req.name(), req.phone(), req.email());
  }

  @GetMapping("/customers/{id}")
  CustomerService.CustomerView get(@PathVariable Long id){
    return customers.get(id);
  }

  @PostMapping("/customers/{id}/properties")
  @ResponseStatus(HttpStatus.CREATED)
  PropertyEntity addProperty(@PathVariable Long id, @Valid @RequestBody PropertyReq req){
    PropertyEntity p = new PropertyEntity();
    p.street = req.street();
    p.city = req.city();
    p.state = req.state();
    p.zip = req.zip();
    p.latitude = req.latitude();
    p.longitude = req.longitude();
    p.accessInstructions = req.accessInstructions();
    p.hazards = req.hazards();
    return customers.addProperty(id, p);
  }

  @PostMapping("/properties/{id}/equipment")
  @ResponseStatus(HttpStatus.CREATED)
  EquipmentEntity addEquipment(@PathVariable Long id, @Valid @RequestBody EquipmentReq req){
    return customers.addEquipment(id, req.type(), req.make(), req.model(), req.installDate(), req.serviceIntervalMonths());
  }

  @DeleteMapping("/customers/{id}")
  Map<String,Object> delete(@PathVariable Long id){
    customers.delete(id);
    return Map.of("ok", true, "id", id, "deleted", true);
  }
}
