package com.fieldops.dispatch.domain;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

public class Entities {
  public enum Role { DISPATCHER, TECHNICIAN, ADMIN }
  public enum SyncEntityType { WORK_ORDER, TECHNICIAN_LOCATION, CUSTOMER, PROPERTY, PRICING }
  public enum SyncItemStatus { PENDING, SYNCING, SYNCED, FAILED_RETRY, FAILED_ABANDONED, MANUAL_REVIEW }

  /** Mobile queue priority; signatures and photos drain before telemetry. */
  public enum SyncPriority { CRITICAL, HIGH, NORMAL, LOW }

  @Entity @Table(name="users")
  public static class UserEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false, unique=true) public String username;
    @Column(nullable=false) public String passwordHash;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public Role role;
    public Long technicianId;
    public boolean active = true;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }

  @Entity @Table(name="customers")
  public static class CustomerEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public String name;
    public String phone;
    public String email;
    public boolean deleted;
    public OffsetDateTime deletedAt;
    public OffsetDateTime createdAt = OffsetDateTime.now();
    public OffsetDateTime updatedAt = OffsetDateTime.now();
  }

  @Entity @Table(name="properties")
  public static class PropertyEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public Long customerId;
    public String street;
    public String city;
    public String state;
    public String zip;
    public Double latitude;
    public Double longitude;
    @Column(columnDefinition="text") public String accessInstructions;
    @Column(columnDefinition="text") public String hazards;
    public boolean deleted;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }

  @Entity @Table(name="equipment")
  public static class EquipmentEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public Long propertyId;
    public String type;
    public String make;
    public String model;
    public LocalDate installDate;
    public Integer serviceIntervalMonths;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }

  @Entity @Table(name="technicians")
  public static class TechnicianEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public String name;

    @ElementCollection(fetch=FetchType.EAGER)
    @CollectionTable(name="technician_skills", joinColumns=@JoinColumn(name="technician_id"))
    @Enumerated(EnumType.STRING) @Column(name="skill")
    public Set<ServiceCategory> skills = new LinkedHashSet<>();

    @ElementCollection(fetch=FetchType.EAGER)
    @CollectionTable(name="technician_certifications", joinColumns=@JoinColumn(name="technician_id"))
    @Column(name="certification")
    public Set<String> certifications = new LinkedHashSet<>();

    @ElementCollection(fetch=FetchType.EAGER)
    @CollectionTable(name="technician_service_areas", joinColumns=@JoinColumn(name="technician_id"))
    @Column(name="zip_prefix")
    public Set<String> serviceAreas = new LinkedHashSet<>();

    public boolean active = true;
    public boolean onCall;
    public Double homeLatitude;
    public Double homeLongitude;
    public Double lastLatitude;
    public Double lastLongitude;
    public OffsetDateTime lastFixAt;
    public LocalTime workdayStart = LocalTime.of(8, 0);
    public LocalTime workdayEnd = LocalTime.of(17, 0);
    public int maxJobsPerDay = 8;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }

  @Entity
  @Table(name="work_orders", indexes = {
      @Index(columnList = "serviceDate,status"),
      @Index(columnList = "technicianId,serviceDate")
  })
  public static class WorkOrderEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public Long customerId;
    @Column(nullable=false) public Long propertyId;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public ServiceCategory category;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public Priority priority;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public WorkOrderStatus status = WorkOrderStatus.CREATED;
    @Column(nullable=false) public LocalDate serviceDate;
    public OffsetDateTime windowStart;
    public OffsetDateTime windowEnd;
    public Long technicianId;
    public int estimatedMinutes = 60;

    @ElementCollection(fetch=FetchType.EAGER)
    @CollectionTable(name="work_order_equipment", joinColumns=@JoinColumn(name="work_order_id"))
    @Column(name="equipment_id")
    public Set<Long> equipmentIds = new LinkedHashSet<>();

    public Double latitude;
    public Double longitude;
    public String zip;
    @Column(columnDefinition="text") public String notes;
    public String signatureRef;

    @ElementCollection(fetch=FetchType.EAGER)
    @CollectionTable(name="work_order_photos", joinColumns=@JoinColumn(name="work_order_id"))
    @Column(name="photo_ref")
    public Set<String> photoRefs = new LinkedHashSet<>();

    public OffsetDateTime actualStart;
    public OffsetDateTime actualEnd;
    public OffsetDateTime eta;
    public Integer routeSequence;
    @Enumerated(EnumType.STRING) public WorkOrderStatus heldFrom;
    public String cancelReason;
    public String lastDispatchOutcome;
    @Column(columnDefinition="text") public String lastDispatchMessage;
    @Column(unique=true) public String idempotencyKey;
    @Version public long version;
    public OffsetDateTime createdAt = OffsetDateTime.now();
    public OffsetDateTime updatedAt = OffsetDateTime.now();

    public WorkOrderEntity copy() {
      WorkOrderEntity c = new WorkOrderEntity();
      c.id = id;
      c.customerId = customerId;
      c.propertyId = propertyId;
      c.category = category;
      c.priority = priority;
      c.status = status;
      c.serviceDate = serviceDate;
      c.windowStart = windowStart;
      c.windowEnd = windowEnd;
      c.technicianId = technicianId;
      c.estimatedMinutes = estimatedMinutes;
      c.equipmentIds = new LinkedHashSet<>(equipmentIds);
      c.latitude = latitude;
      c.longitude = longitude;
      c.zip = zip;
      c.notes = notes;
      c.signatureRef = signatureRef;
      c.photoRefs = new LinkedHashSet<>(photoRefs);
      c.actualStart = actualStart;
      c.actualEnd = actualEnd;
      c.eta = eta;
      c.routeSequence = routeSequence;
      c.heldFrom = heldFrom;
      c.cancelReason = cancelReason;
      c.lastDispatchOutcome = lastDispatchOutcome;
      c.lastDispatchMessage = lastDispatchMessage;
      c.idempotencyKey = idempotencyKey;
      c.version = version;
      c.createdAt = createdAt;
      c.updatedAt = updatedAt;
      return c;
    }
  }

  @Entity @Table(name="assignments", indexes = @Index(columnList = "workOrderId,active"))
  public static class AssignmentEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public Long workOrderId;
    @Column(nullable=false) public Long technicianId;
    public double score;
    @Column(columnDefinition="text") public String breakdownJson;
    @Column(columnDefinition="text") public String reasoning;
    public boolean active = true;
    public String assignedBy;
    public OffsetDateTime assignedAt = OffsetDateTime.now();
    public OffsetDateTime supersededAt;
  }

  @Entity @Table(name="work_order_events")
  public static class WorkOrderEventEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public Long workOrderId;
    @Enumerated(EnumType.STRING) public WorkOrderStatus fromStatus;
    @Enumerated(EnumType.STRING) public WorkOrderStatus toStatus;
    public String actor;
    @Column(columnDefinition="text") public String reason;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }

  @Entity @Table(name="sync_queue_items", indexes = @Index(columnList = "status,nextAttemptAt"))
  public static class SyncQueueItemEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false, unique=true) public String idempotencyKey;
    @Column(nullable=false) public String deviceId;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public SyncEntityType entityType;
    @Column(nullable=false) public Long entityId;
    public String operation;
    @Column(columnDefinition="text") public String payloadJson;
    public Long baseVersion;
    @Enumerated(EnumType.STRING) public SyncPriority priority = SyncPriority.NORMAL;
    public int attempts;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public SyncItemStatus status = SyncItemStatus.PENDING;
    @Column(columnDefinition="text") public String lastError;
    @Column(columnDefinition="text") public String resultJson;
    public String submittedBy;
    public OffsetDateTime capturedAt;
    public OffsetDateTime nextAttemptAt;
    public OffsetDateTime receivedAt = OffsetDateTime.now();
    public OffsetDateTime appliedAt;
  }

  @Entity
  @Table(name="sync_field_stamps", uniqueConstraints = @UniqueConstraint(columnNames = {"entityType", "entityId", "field"}))
  public static class SyncFieldStampEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public SyncEntityType entityType;
    @Column(nullable=false) public Long entityId;
    @Column(nullable=false) public String field;
    @Column(nullable=false) public String deviceId;
    public long entityVersion;
    public OffsetDateTime syncedAt = OffsetDateTime.now();
  }

  @Entity @Table(name="maintenance_agreements")
  public static class MaintenanceAgreementEntity {
    @Id @GeneratedValue(strategy=GenerationType.IDENTITY) public Long id;
    @Column(nullable=false) public Long customerId;
    @Column(nullable=false) public Long propertyId;
    public Long equipmentId;
    @Enumerated(EnumType.STRING) @Column(nullable=false) public ServiceCategory category;
    public int intervalMonths = 6;
    public int estimatedMinutes = 90;
    @Column(nullable=false) public LocalDate nextDueDate;
    public Long preferredTechnicianId;
    public boolean active = true;
    public Long lastGeneratedWorkOrderId;
    public OffsetDateTime createdAt = OffsetDateTime.now();
  }
}
