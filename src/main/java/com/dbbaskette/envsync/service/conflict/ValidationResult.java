package com.dbbaskette.envsync.service.conflict;

import java.util.List;

public record ValidationResult(boolean valid, List<MissingEntry> missing, List<ConflictEntry> conflicts,
                               Summary summary, List<String> remediationSteps, String correlationId,
                               long durationMs) {

    public record Summary(int totalSecrets, int missingCount, int conflictCount, int validCount) {}
}
