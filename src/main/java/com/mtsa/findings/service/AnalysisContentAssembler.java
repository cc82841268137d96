package com.mtsa.findings.service;

import com.mtsa.findings.model.AnalysisContent;
import com.mtsa.findings.model.AnalysisOutput;
import com.mtsa.findings.model.AnalysisSection;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.GenerationMetadata;
import com.mtsa.findings.model.MultiSourceContent;
import com.mtsa.findings.model.SingleSourceContent;
import com.mtsa.findings.model.TabularContent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a typed {@link FindingsCandidate} from raw generator output.
 * <p>
 * For single-source combinations the temporal, seasonal and spectral sections are folded into the
 * principal findings under localized sub-headers, and any cross-source sections the generator
 * returned are set aside for the validator. Tables are rendered to Markdown and appended to the
 * section they belong to.
 */
@Component
public class AnalysisContentAssembler {

    private static final List<AnalysisSection> FOLDED_SECTIONS = List.of(
            AnalysisSection.TEMPORAL_ANALYSIS,
            AnalysisSection.SEASONAL_ANALYSIS,
            AnalysisSection.SPECTRAL_ANALYSIS);

    private static final Map<AnalysisSection, Integer> CONFIDENCE_TARGETS = Map.of(
            AnalysisSection.EXECUTIVE_SUMMARY, 150,
            AnalysisSection.PRINCIPAL_FINDINGS, 500,
            AnalysisSection.TEMPORAL_ANALYSIS, 300,
            AnalysisSection.SEASONAL_ANALYSIS, 250,
            AnalysisSection.SPECTRAL_ANALYSIS, 250,
            AnalysisSection.CORRELATION_ANALYSIS, 400,
            AnalysisSection.COMPONENT_ANALYSIS, 400);

    private final MarkdownTableRenderer tableRenderer;
    private final int schemaVersion;

    public AnalysisContentAssembler(MarkdownTableRenderer tableRenderer,
                                    @Value("${app.findings.schema-version:2}") int schemaVersion) {
        this.tableRenderer = tableRenderer;
        this.schemaVersion = schemaVersion;
    }

    public FindingsCandidate assemble(CombinationKey key, AnalysisOutput output, long measuredLatencyMs) {
        Map<AnalysisSection, String> texts = new EnumMap<>(AnalysisSection.class);
        for (AnalysisSection section : AnalysisSection.values()) {
            texts.put(section, withTable(output.section(section), output.table(section)));
        }

        AnalysisContent content;
        Map<AnalysisSection, String> strays = new EnumMap<>(AnalysisSection.class);
        if (key.analysisType() == AnalysisType.SINGLE) {
            content = new SingleSourceContent(
                    texts.get(AnalysisSection.EXECUTIVE_SUMMARY),
                    foldPrincipalFindings(texts, key.language()),
                    texts.get(AnalysisSection.STRATEGIC_SYNTHESIS),
                    texts.get(AnalysisSection.CONCLUSIONS));
            for (AnalysisSection section : AnalysisSection.values()) {
                if (section.isCrossSource() && !texts.get(section).isBlank()) {
                    strays.put(section, texts.get(section));
                }
            }
        } else {
            content = new MultiSourceContent(
                    texts.get(AnalysisSection.EXECUTIVE_SUMMARY),
                    texts.get(AnalysisSection.PRINCIPAL_FINDINGS),
                    texts.get(AnalysisSection.STRATEGIC_SYNTHESIS),
                    texts.get(AnalysisSection.CONCLUSIONS),
                    texts.get(AnalysisSection.CORRELATION_ANALYSIS),
                    texts.get(AnalysisSection.COMPONENT_ANALYSIS),
                    texts.get(AnalysisSection.TEMPORAL_ANALYSIS),
                    texts.get(AnalysisSection.SEASONAL_ANALYSIS),
                    texts.get(AnalysisSection.SPECTRAL_ANALYSIS));
        }

        GenerationMetadata metadata = new GenerationMetadata(
                output.getGeneratorId() == null ? "" : output.getGeneratorId().trim(),
                output.getLatencyMs() != null ? output.getLatencyMs() : measuredLatencyMs,
                resolveConfidence(output, texts, key.analysisType()),
                output.getDataPoints() != null ? output.getDataPoints() : 0);

        return new FindingsCandidate(key, content, metadata, strays, schemaVersion);
    }

    private String foldPrincipalFindings(Map<AnalysisSection, String> texts, String language) {
        StringBuilder folded = new StringBuilder(texts.get(AnalysisSection.PRINCIPAL_FINDINGS).strip());
        for (AnalysisSection section : FOLDED_SECTIONS) {
            String text = texts.get(section).strip();
            if (text.isEmpty()) {
                continue;
            }
            if (!folded.isEmpty()) {
                folded.append("\n\n");
            }
            folded.append("### ").append(label(section, language)).append("\n\n").append(text);
        }
        return folded.toString();
    }

    private String withTable(String text, TabularContent table) {
        String rendered = tableRenderer.render(table);
        if (rendered.isEmpty()) {
            return text == null ? "" : text;
        }
        if (text == null || text.isBlank()) {
            return rendered;
        }
        return text.stripTrailing() + "\n\n" + rendered;
    }

    /**
     * Reported score when plausible, otherwise the mean length-to-target ratio of present sections.
     */
    private double resolveConfidence(AnalysisOutput output, Map<AnalysisSection, String> texts, AnalysisType type) {
        Double reported = output.getConfidenceScore();
        if (reported != null && reported > 0.0 && reported <= 1.0) {
            return reported;
        }
        double sum = 0.0;
        int factors = 0;
        for (Map.Entry<AnalysisSection, Integer> target : CONFIDENCE_TARGETS.entrySet()) {
            if (type == AnalysisType.SINGLE && target.getKey().isCrossSource()) {
                continue;
            }
            String text = texts.get(target.getKey());
            if (text == null || text.isBlank()) {
                continue;
            }
            sum += Math.min(text.strip().length() / (double) target.getValue(), 1.0);
            factors++;
        }
        return factors == 0 ? 0.5 : sum / factors;
    }

    private static String label(AnalysisSection section, String language) {
        boolean spanish = "es".equals(language);
        return switch (section) {
            case TEMPORAL_ANALYSIS -> spanish ? "Análisis temporal" : "Temporal analysis";
            case SEASONAL_ANALYSIS -> spanish ? "Análisis estacional" : "Seasonal analysis";
            case SPECTRAL_ANALYSIS -> spanish ? "Análisis espectral" : "Spectral analysis";
            default -> section.key();
        };
    }
}
