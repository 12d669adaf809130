package org.dxworks.clippy.platform;

import java.util.List;

public record CompatibilityReport(String platformId, boolean compatible, List<CompatibilityIssue> issues) {

    public CompatibilityReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static CompatibilityReport of(String platformId, List<CompatibilityIssue> issues) {
        boolean compatible = issues.stream().noneMatch(issue -> issue.severity() == CompatibilityIssue.Severity.ERROR);
        return new CompatibilityReport(platformId, compatible, issues);
    }

    public List<CompatibilityIssue> errors() {
        return issues.stream().filter(issue -> issue.severity() == CompatibilityIssue.Severity.ERROR).toList();
    }

    public List<CompatibilityIssue> warnings() {
        return issues.stream().filter(issue -> issue.severity() == CompatibilityIssue.Severity.WARNING).toList();
    }
}
