package com.example.monitoring.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanVersionResponse(
    long versionId,
    long planId,
    int versionNumber,
    String versionName,
    LocalDate effectiveDate,
    Instant publishedAt,
    int modelCount) {}
