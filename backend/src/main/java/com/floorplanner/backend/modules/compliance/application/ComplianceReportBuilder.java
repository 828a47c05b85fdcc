package com.floorplanner.backend.modules.compliance.application;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.compliance.domain.ComplianceSummary;
import com.floorplanner.backend.modules.compliance.domain.Severity;
import com.floorplanner.backend.modules.compliance.domain.Violation;

/**
 * Renders a {@link ComplianceResult} as plain text, violations grouped by severity.
 */
@Component
public class ComplianceReportBuilder {

    static final String NO_VIOLATIONS = "✓ No violations found. Plan is fully compliant!";

    public String build(ComplianceResult result) {
        ComplianceSummary summary = result.summary();
        StringBuilder report = new StringBuilder();
        report.append('\n')
                .append("BUILDING CODE COMPLIANCE REPORT\n")
                .append("================================\n\n")
                .append("Overall Grade: ").append(result.grade().label()).append('\n')
                .append("Compliance Score: ").append(result.complianceScore()).append("/100\n")
                .append("Status: ").append(result.compliant() ? "COMPLIANT" : "NON-COMPLIANT").append("\n\n")
                .append("Summary:\n")
                .append("--------\n")
                .append("Critical Violations: ").append(summary.critical()).append('\n')
                .append("Warnings: ").append(summary.warnings()).append('\n')
                .append("Informational: ").append(summary.info()).append('\n')
                .append("Total Issues: ").append(summary.total()).append("\n\n");

        if (result.violations().isEmpty()) {
            report.append('\n').append(NO_VIOLATIONS).append('\n');
            return report.toString();
        }

        report.append("\nDetailed Violations:\n")
                .append("-------------------\n\n");
        for (Severity severity : Severity.values()) {
            List<Violation> group = result.violationsOf(severity);
            if (group.isEmpty()) {
                continue;
            }
            report.append('\n').append(severity.name().toUpperCase(Locale.ROOT)).append(":\n");
            for (Violation violation : group) {
                report.append("  [").append(violation.code()).append("] ").append(violation.room()).append('\n')
                        .append("    Issue: ").append(violation.message()).append('\n');
                if (violation.hasRecommendation()) {
                    report.append("    Fix: ").append(violation.recommendation()).append('\n');
                }
                report.append('\n');
            }
        }
        return report.toString();
    }
}
