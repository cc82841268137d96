package com.mtsa.findings.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw result of one generator call: named text sections, optional tables per section and the
 * numeric metadata the generator could report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOutput {

    @Builder.Default
    private Map<String, String> sections = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, TabularContent> tables = new LinkedHashMap<>();

    private String generatorId;
    private Long latencyMs;
    private Double confidenceScore;
    private Integer dataPoints;

    /**
     * Text of a section, resolving legacy aliases; empty when absent.
     */
    @JsonIgnore
    public String section(AnalysisSection section) {
        return lookup(sections, section, "");
    }

    @JsonIgnore
    public TabularContent table(AnalysisSection section) {
        return lookup(tables, section, null);
    }

    private static <T> T lookup(Map<String, T> values, AnalysisSection section, T fallback) {
        if (values == null) {
            return fallback;
        }
        T direct = values.get(section.key());
        if (direct != null) {
            return direct;
        }
        for (String alias : section.aliases()) {
            T aliased = values.get(alias);
            if (aliased != null) {
                return aliased;
            }
        }
        return fallback;
    }
}
