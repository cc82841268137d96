package com.mtsa.findings.model;

import java.util.List;

/**
 * Classification of a candidate record together with the rules it failed.
 */
public record ValidationResult(ValidationStatus status, List<ValidationIssue> issues) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasIssue(ValidationIssue issue) {
        return issues.contains(issue);
    }

    public List<String> issueNames() {
        return issues.stream().map(Enum::name).toList();
    }
}
