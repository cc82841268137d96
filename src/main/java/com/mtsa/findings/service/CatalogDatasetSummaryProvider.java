package com.mtsa.findings.service;

import com.google.common.collect.ImmutableMap;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.DatasetSummary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes each source series by its coverage window and sampling frequency, evaluated against a
 * fixed as-of date so the same combination always yields the same summary.
 */
@Component
public class CatalogDatasetSummaryProvider implements DatasetSummaryProvider {

    private record SeriesProfile(LocalDate start, boolean monthly) {
    }

    private static final Map<String, SeriesProfile> PROFILES = ImmutableMap.of(
            "google trends", new SeriesProfile(LocalDate.of(2004, 1, 1), true),
            "google books", new SeriesProfile(LocalDate.of(1950, 1, 1), false),
            "bain usability", new SeriesProfile(LocalDate.of(1993, 1, 1), false),
            "bain satisfaction", new SeriesProfile(LocalDate.of(1993, 1, 1), false),
            "crossref", new SeriesProfile(LocalDate.of(1950, 1, 1), true));

    private static final SeriesProfile FALLBACK = new SeriesProfile(LocalDate.of(2000, 1, 1), false);

    private final CombinationCatalog catalog;
    private final LocalDate asOf;

    public CatalogDatasetSummaryProvider(CombinationCatalog catalog,
                                         @Value("${app.dataset.as-of:2025-01-01}") String asOf) {
        this.catalog = catalog;
        this.asOf = LocalDate.parse(asOf);
    }

    @Override
    public DatasetSummary summarize(CombinationKey key) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        int dataPoints = 0;
        for (String source : key.sources()) {
            SeriesProfile profile = PROFILES.getOrDefault(source, FALLBACK);
            int points = (int) (profile.monthly()
                    ? ChronoUnit.MONTHS.between(profile.start(), asOf)
                    : ChronoUnit.YEARS.between(profile.start(), asOf));
            dataPoints += Math.max(points, 0);
            attributes.put(source + ".start", profile.start().toString());
            attributes.put(source + ".frequency", profile.monthly() ? "monthly" : "annual");
            attributes.put(source + ".points", Math.max(points, 0));
        }
        attributes.put("analysisType", key.analysisType().name());
        return new DatasetSummary(
                catalog.toolDisplayName(key.tool()),
                catalog.sourceDisplayNames(key.sources()),
                asOf,
                dataPoints,
                attributes);
    }
}
