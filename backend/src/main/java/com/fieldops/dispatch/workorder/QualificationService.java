package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.GeoPoint;
import com.fieldops.dispatch.scheduler.DispatchProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Serviceability checks behind {@code CREATED -> QUALIFIED}.
 */
@Component
public class QualificationService {
  private final DispatchProperties properties;

  public QualificationService(DispatchProperties properties) {
    this.properties = properties;
  }

  public List<String> problems(WorkOrderEntity w) {
    List<String> problems = new ArrayList<>();
    if (w.category == null || !properties.getSupportedCategories().contains(w.category)) {
      problems.add("service category " + w.category + " is not offered");
    }
    GeoPoint location = GeoPoint.ofNullable(w.latitude, w.longitude);
    if (location == null || !location.isValid()) {
      problems.add("property has no valid coordinates");
    }
    List<String> areas = properties.getServiceAreas();
    if (!areas.isEmpty()) {
      String zip = w.zip == null ? "" : w.zip.trim();
      boolean covered = StringUtils.hasText(zip) && areas.stream().anyMatch(zip::startsWith);
      if (!covered) {
        problems.add("zip " + (StringUtils.hasText(zip) ? zip : "(missing)") + " is outside the service area");
      }
    }
    return problems;
  }

  public void check(WorkOrderEntity w) {
    List<String> problems = problems(w);
    if (!problems.isEmpty()) {
      throw new UnqualifiedLeadException(w.id, problems);
    }
  }
}
