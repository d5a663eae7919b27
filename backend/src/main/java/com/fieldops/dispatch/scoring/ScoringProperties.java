package com.fieldops.dispatch.scoring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.scoring")
public class ScoringProperties {
  private double skillWeight = 0.40;
  private double travelWeight = 0.25;
  private double workloadWeight = 0.20;
  private double continuityWeight = 0.10;
  private double locationRecencyWeight = 0.05;
  private double travelCeilingMinutes = 60.0;
  private double approximateTravelDiscount = 0.8;
  private double workloadPenaltyPerJob = 20.0;
  private Duration freshLocationWithin = Duration.ofMinutes(15);
  private Duration locationStaleAfter = Duration.ofHours(4);

  public ScoringPolicy toPolicy() {
    return new ScoringPolicy(
        new ScoringWeights(skillWeight, travelWeight, workloadWeight, continuityWeight, locationRecencyWeight),
        travelCeilingMinutes, approximateTravelDiscount, workloadPenaltyPerJob, freshLocationWithin, locationStaleAfter);
  }

  public double getSkillWeight() {
    return skillWeight;
  }

  public void setSkillWeight(double skillWeight) {
    this.skillWeight = skillWeight;
  }

  public double getTravelWeight() {
    return travelWeight;
  }

  public void setTravelWeight(double travelWeight) {
    this.travelWeight = travelWeight;
  }

  public double getWorkloadWeight() {
    return workloadWeight;
  }

  public void setWorkloadWeight(double workloadWeight) {
    this.workloadWeight = workloadWeight;
  }

  public double getContinuityWeight() {
    return continuityWeight;
  }

  public void setContinuityWeight(double continuityWeight) {
    this.continuityWeight = continuityWeight;
  }

  public double getLocationRecencyWeight() {
    return locationRecencyWeight;
  }

  public void setLocationRecencyWeight(double locationRecencyWeight) {
    this.locationRecencyWeight = locationRecencyWeight;
  }

  public double getTravelCeilingMinutes() {
    return travelCeilingMinutes;
  }

  public void setTravelCeilingMinutes(double travelCeilingMinutes) {
    this.travelCeilingMinutes = travelCeilingMinutes;
  }

  public double getApproximateTravelDiscount() {
    return approximateTravelDiscount;
  }

  public void setApproximateTravelDiscount(double approximateTravelDiscount) {
    this.approximateTravelDiscount = approximateTravelDiscount;
  }

  public double getWorkloadPenaltyPerJob() {
    return workloadPenaltyPerJob;
  }

  public void setWorkloadPenaltyPerJob(double workloadPenaltyPerJob) {
    this.workloadPenaltyPerJob = workloadPenaltyPerJob;
  }

  public Duration getFreshLocationWithin() {
    return freshLocationWithin;
  }

  public void setFreshLocationWithin(Duration freshLocationWithin) {
    this.freshLocationWithin = freshLocationWithin;
  }

  public Duration getLocationStaleAfter() {
    return locationStaleAfter;
  }

  public void setLocationStaleAfter(Duration locationStaleAfter) {
    this.locationStaleAfter = locationStaleAfter;
  }
}
