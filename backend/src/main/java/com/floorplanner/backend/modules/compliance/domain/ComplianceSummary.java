package com.floorplanner.backend.modules.compliance.domain;

import java.util.List;

public record ComplianceSummary(
        int critical,
        int warnings,
        int info,
        int total
) {

    public static ComplianceSummary of(List<Violation> violations) {
        int critical = count(violations, Severity.CRITICAL);
        int warnings = count(violations, Severity.WARNING);
        int info = count(violations, Severity.INFO);
        return new ComplianceSummary(critical, warnings, info, violations.size());
    }

    private static int count(List<Violation> violations, Severity severity) {
        return (int) violations.stream().filter(v -> v.severity() == severity).count();
    }
}
