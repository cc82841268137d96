package com.mtsa.findings.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Deterministic description of the data behind a combination, as handed to the generator.
 */
public record DatasetSummary(String toolName,
                             List<String> sourceNames,
                             LocalDate asOf,
                             int dataPoints,
                             Map<String, Object> attributes) {

    public DatasetSummary {
        sourceNames = List.copyOf(sourceNames);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
