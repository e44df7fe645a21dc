package com.example.monitoring.model;

public record ScopeModel(long modelId, String modelName) {}
