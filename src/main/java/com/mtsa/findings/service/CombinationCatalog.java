package com.mtsa.findings.service;

import com.google.common.collect.ImmutableMap;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The recognized tools, sources and languages. Identifiers are the normalized form of the display
 * names; display names are kept for prompts.
 */
@Component
public class CombinationCatalog {

    public static final List<String> DEFAULT_TOOLS = List.of(
            "Alianzas y Capital de Riesgo",
            "Benchmarking",
            "Calidad Total",
            "Competencias Centrales",
            "Cuadro de Mando Integral",
            "Estrategias de Crecimiento",
            "Experiencia del Cliente",
            "Fusiones y Adquisiciones",
            "Gestión de Costos",
            "Gestión de la Cadena de Suministro",
            "Gestión del Cambio",
            "Gestión del Conocimiento",
            "Innovación Colaborativa",
            "Lealtad del Cliente",
            "Liderazgo Transformacional",
            "Mercadeo Digital",
            "Modelo de Negocio",
            "Optimización de Procesos",
            "Reingeniería de Procesos",
            "Retención de Talento",
            "Revolución Industrial 4.0");

    public static final List<String> DEFAULT_SOURCES = List.of(
            "Google Trends",
            "Google Books",
            "Bain Usability",
            "Crossref",
            "Bain Satisfaction");

    public static final List<String> DEFAULT_LANGUAGES = List.of("es", "en");

    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");

    private final ImmutableMap<String, String> tools;
    private final ImmutableMap<String, String> sources;
    private final ImmutableMap<String, String> languages;

    public CombinationCatalog(@Value("${app.catalog.tools:}") List<String> tools,
                              @Value("${app.catalog.sources:}") List<String> sources,
                              @Value("${app.catalog.languages:}") List<String> languages) {
        this.tools = index(orDefault(tools, DEFAULT_TOOLS));
        this.sources = index(orDefault(sources, DEFAULT_SOURCES));
        this.languages = index(orDefault(languages, DEFAULT_LANGUAGES));
    }

    public static CombinationCatalog defaults() {
        return new CombinationCatalog(DEFAULT_TOOLS, DEFAULT_SOURCES, DEFAULT_LANGUAGES);
    }

    /**
     * Lower-cases, trims and collapses runs of whitespace or underscores to a single space.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return SEPARATORS.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public boolean isKnownTool(String normalizedTool) {
        return tools.containsKey(normalizedTool);
    }

    public boolean isKnownSource(String normalizedSource) {
        return sources.containsKey(normalizedSource);
    }

    public boolean isKnownLanguage(String normalizedLanguage) {
        return languages.containsKey(normalizedLanguage);
    }

    public List<String> toolIds() {
        return tools.keySet().asList();
    }

    public List<String> sourceIds() {
        return sources.keySet().asList();
    }

    public List<String> languageIds() {
        return languages.keySet().asList();
    }

    public String toolDisplayName(String toolId) {
        return Optional.ofNullable(tools.get(toolId)).orElse(toolId);
    }

    public List<String> sourceDisplayNames(List<String> sourceIds) {
        return sourceIds.stream()
                .map(id -> Optional.ofNullable(sources.get(id)).orElse(id))
                .toList();
    }

    private static List<String> orDefault(List<String> configured, List<String> defaults) {
        if (configured == null) {
            return defaults;
        }
        List<String> cleaned = configured.stream()
                .filter(v -> v != null && !v.isBlank())
                .toList();
        return cleaned.isEmpty() ? defaults : cleaned;
    }

    private static ImmutableMap<String, String> index(List<String> displayNames) {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (String displayName : displayNames) {
            builder.put(normalize(displayName), displayName.trim());
        }
        return builder.buildKeepingLast();
    }
}
