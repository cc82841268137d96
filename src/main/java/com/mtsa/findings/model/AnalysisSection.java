package com.mtsa.findings.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Named narrative sections produced by the analysis generator.
 * Each section has a wire key and optional legacy aliases accepted on input.
 */
public enum AnalysisSection {

    EXECUTIVE_SUMMARY("executive_summary"),
    PRINCIPAL_FINDINGS("principal_findings"),
    TEMPORAL_ANALYSIS("temporal_analysis"),
    SEASONAL_ANALYSIS("seasonal_analysis"),
    SPECTRAL_ANALYSIS("spectral_analysis", "fourier_analysis"),
    CORRELATION_ANALYSIS("correlation_analysis", "heatmap_analysis"),
    COMPONENT_ANALYSIS("component_analysis", "pca_analysis"),
    STRATEGIC_SYNTHESIS("strategic_synthesis"),
    CONCLUSIONS("conclusions");

    private final String key;
    private final List<String> aliases;

    AnalysisSection(String key, String... aliases) {
        this.key = key;
        this.aliases = List.of(aliases);
    }

    public String key() {
        return key;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Sections that only make sense with two or more sources.
     */
    public boolean isCrossSource() {
        return this == CORRELATION_ANALYSIS || this == COMPONENT_ANALYSIS;
    }

    public static Optional<AnalysisSection> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (AnalysisSection section : values()) {
            if (section.key.equals(normalized) || section.aliases.contains(normalized)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
