package com.dbbaskette.envsync.service.distribution;

public record EnvironmentSummary(String name, String action, String status) {}
