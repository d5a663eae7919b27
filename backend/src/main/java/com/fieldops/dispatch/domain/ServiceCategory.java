package com.fieldops.dispatch.domain;

public enum ServiceCategory {
  HVAC,
  PLUMBING,
  ELECTRICAL,
  GENERAL
}
