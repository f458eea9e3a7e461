package com.dbbaskette.envsync.service.conflict;

public record MissingEntry(String secretName, String scope) {}
