package com.mtsa.findings.dto;

public record RevalidationReport(int checked, int valid, int partial, int invalidated, int changed) {
}
