package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.domain.ServiceCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "app.dispatch")
public class DispatchProperties {
  private int candidatePoolSize = 8;
  private long candidateTimeoutMs = 10_000;
  private int maxConflictRetries = 3;
  private Set<ServiceCategory> supportedCategories = EnumSet.allOf(ServiceCategory.class);
  /** Zip prefixes served; empty means no area restriction. */
  private List<String> serviceAreas = new ArrayList<>();
  private String zone = "UTC";

  public int getCandidatePoolSize() {
    return candidatePoolSize;
  }

  public void setCandidatePoolSize(int candidatePoolSize) {
    this.candidatePoolSize = Math.max(1, candidatePoolSize);
  }

  public long getCandidateTimeoutMs() {
    return candidateTimeoutMs;
  }

  public void setCandidateTimeoutMs(long candidateTimeoutMs) {
    this.candidateTimeoutMs = candidateTimeoutMs;
  }

  public int getMaxConflictRetries() {
    return maxConflictRetries;
  }

  public void setMaxConflictRetries(int maxConflictRetries) {
    this.maxConflictRetries = Math.max(1, maxConflictRetries);
  }

  public Set<ServiceCategory> getSupportedCategories() {
    return supportedCategories;
  }

  public void setSupportedCategories(Set<ServiceCategory> supportedCategories) {
    this.supportedCategories = supportedCategories == null || supportedCategories.isEmpty()
        ? EnumSet.allOf(ServiceCategory.class)
        : EnumSet.copyOf(supportedCategories);
  }

  public List<String> getServiceAreas() {
    return serviceAreas;
  }

  public void setServiceAreas(List<String> serviceAreas) {
    this.serviceAreas = serviceAreas == null ? new ArrayList<>() : new ArrayList<>(serviceAreas);
  }

  public String getZone() {
    return zone;
  }

  public void setZone(String zone) {
    this.zone = zone;
  }
}
