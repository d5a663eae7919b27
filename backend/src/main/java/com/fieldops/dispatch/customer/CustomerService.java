package com.fieldops.dispatch.customer;

import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.CustomerRepository;
import com.fieldops.dispatch.domain.Entities.CustomerEntity;
import com.fieldops.dispatch.domain.Entities.EquipmentEntity;
import com.fieldops.dispatch.domain.Entities.PropertyEntity;
import com.fieldops.dispatch.domain.EquipmentRepository;
import com.fieldops.dispatch.domain.GeoPoint;
import com.fieldops.dispatch.domain.PropertyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

@Service
public class CustomerService {
  private static final Logger log = LoggerFactory.getLogger(CustomerService.class);

  private final CustomerRepository customers;
  private final PropertyRepository properties;
  private final EquipmentRepository equipment;
  private final Clock clock;

  public CustomerService(CustomerRepository customers, PropertyRepository properties, EquipmentRepository equipment, Clock clock) {
    this.customers = customers;
    this.properties = properties;
    this.equipment = equipment;
    this.clock = clock;
  }

  public record PropertyView(PropertyEntity property, List<EquipmentEntity> equipment) {}
  public record CustomerView(CustomerEntity customer, List<PropertyView> properties) {}

  @Transactional
  public CustomerEntity create(String name, String phone, String email) {
    CustomerEntity c = new CustomerEntity();
    c.name = name.trim();
    c.phone = phone;
    c.email = email;
    OffsetDateTime now = OffsetDateTime.now(clock);
    c.createdAt = now;
    c.updatedAt = now;
    return customers.save(c);
  }

  public CustomerView get(Long id) {
    CustomerEntity c = active(id);
    List<PropertyView> views = properties.findByCustomerIdOrderByIdAsc(id).stream()
        .filter(p -> !p.deleted)
        .map(p -> new PropertyView(p, equipment.findByPropertyIdOrderByIdAsc(p.id)))
        .toList();
    return new CustomerView(c, views);
  }

  @Transactional
  public PropertyEntity addProperty(Long customerId, PropertyEntity draft) {
    active(customerId);
    GeoPoint point = GeoPoint.ofNullable(draft.latitude, draft.longitude);
    if (point != null && !point.isValid()) {
      throw new ValidationException("Property coordinates are out of range", "latitude");
    }
    if ((draft.latitude == null) != (draft.longitude == null)) {
      throw new ValidationException("latitude and longitude must be given together", "latitude");
    }
    draft.id = null;
    draft.customerId = customerId;
    draft.deleted = false;
    draft.createdAt = OffsetDateTime.now(clock);
    PropertyEntity saved = properties.save(draft);
    if (point == null) {
      log.info("Property {} of customer {} has no coordinates; its work orders will need manual qualification", saved.id, customerId);
    }
    return saved;
  }

  @Transactional
  public EquipmentEntity addEquipment(Long propertyId, String type, String make, String model, LocalDate installDate,
                                      Integer serviceIntervalMonths) {
    PropertyEntity p = properties.findById(propertyId).filter(x -> !x.deleted)
        .orElseThrow(() -> new NotFoundException("Property", propertyId));
    if (serviceIntervalMonths != null && serviceIntervalMonths <= 0) {
      throw new ValidationException("serviceIntervalMonths must be positive", "serviceIntervalMonths");
    }
    EquipmentEntity e = new EquipmentEntity();
    e.propertyId = p.id;
    e.type = type;
    e.make = make;
    e.model = model;
    e.installDate = installDate;
    e.serviceIntervalMonths = serviceIntervalMonths;
    e.createdAt = OffsetDateTime.now(clock);
    return equipment.save(e);
  }

  /** Soft delete. Existing work orders keep their references; new ones are refused. */
  @Transactional
  public void delete(Long id) {
    CustomerEntity c = active(id);
    OffsetDateTime now = OffsetDateTime.now(clock);
    c.deleted = true;
    c.deletedAt = now;
    c.updatedAt = now;
    customers.save(c);
    for (PropertyEntity p : properties.findByCustomerIdOrderByIdAsc(id)) {
      if (!p.deleted) {
        p.deleted = true;
        properties.save(p);
      }
    }
    log.info("Customer {} soft-deleted", id);
  }

  private CustomerEntity active(Long id) {
    return customers.findByIdAndDeletedFalse(id).orElseThrow(() -> new NotFoundException("Customer", id));
  }
}
