package com.example.monitoring.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MembershipSummary(
    long membershipId,
    long planId,
    Instant effectiveFrom,
    Instant effectiveTo,
    String reason,
    String changedByUserId,
    boolean active) {}
