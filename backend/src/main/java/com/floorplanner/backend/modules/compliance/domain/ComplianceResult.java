package com.floorplanner.backend.modules.compliance.domain;

import java.util.List;

public record ComplianceResult(
        boolean compliant,
        int complianceScore,
        ComplianceGrade grade,
        List<Violation> violations,
        ComplianceSummary summary
) {

    public static final int MAX_SCORE = 100;

    public ComplianceResult {
        violations = List.copyOf(violations);
    }

    /**
     * Scores a violation list: 100 minus 20 per critical, 5 per warning and 1 per info, floored at 0.
     */
    public static ComplianceResult of(List<Violation> violations) {
        ComplianceSummary summary = ComplianceSummary.of(violations);
        int penalty = violations.stream().mapToInt(v -> v.severity().penalty()).sum();
        int score = Math.max(0, MAX_SCORE - penalty);
        return new ComplianceResult(
                summary.critical() == 0,
                score,
                ComplianceGrade.fromScore(score),
                violations,
                summary
        );
    }

    public List<Violation> violationsOf(Severity severity) {
        return violations.stream().filter(v -> v.severity() == severity).toList();
    }
}
